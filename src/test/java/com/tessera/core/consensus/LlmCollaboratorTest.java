package com.tessera.core.consensus;

import com.tessera.core.llm.GenerationFailureException;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.Verdict;
import com.tessera.core.prompt.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class LlmCollaboratorTest {

    private TextGenerationClient client;
    private final JsonResponseReader reader = new JsonResponseReader();
    private final PromptBuilder promptBuilder = new PromptBuilder();
    private final ConsensusRequest request = new ConsensusRequest("Plan a science fair", "4 participants",
            null, Duration.ofSeconds(7), 300);

    @BeforeEach
    void setUp() {
        client = mock(TextGenerationClient.class);
    }

    private void reply(String json) {
        when(client.generate(anyString(), anyInt(), any())).thenReturn(json);
    }

    @Test
    @DisplayName("Structural proposer reads the described structure")
    void structuralReply() {
        reply("""
                {"activity_type": "stations", "stages": ["setup", "rotation", "debrief"],
                 "collaboration_mode": "small groups", "suggested_item_count": 5, "summary": "Rotating stations",
                 "verdict": "approved", "score": 0.9}
                """);

        ProposalDecision decision = new StructuralProposer(client, reader, promptBuilder).propose(request);

        assertEquals("stations", decision.structure().activityType());
        assertEquals(List.of("setup", "rotation", "debrief"), decision.structure().stages());
        assertEquals(CollaborationMode.GROUP, decision.structure().collaborationMode());
        assertEquals(5, decision.structure().suggestedItemCount());
        assertEquals(Verdict.APPROVED, decision.verdict());
        assertEquals(0.9, decision.score(), 1e-9);
        verify(client).generate(contains("Plan a science fair"), eq(300), eq(Duration.ofSeconds(7)));
    }

    @Test
    @DisplayName("Structural proposer without a structure proposes the canonical one")
    void structuralDefaults() {
        reply("{\"summary\": \"fine\"}");

        ProposalDecision decision = new StructuralProposer(client, reader, promptBuilder).propose(request);

        assertEquals(ProposalStructure.CANONICAL, decision.structure());
        assertEquals(Verdict.APPROVED, decision.verdict());
        assertEquals(0.8, decision.score(), 1e-9);
    }

    @Test
    @DisplayName("Pedagogical evaluator keeps adjustments as adaptations and defaults to requiring revision")
    void pedagogicalReply() {
        reply("{\"adaptations\": [\"visual schedule\"], \"adjustments\": [\"shorter stations\"]}");

        ProposalDecision decision = new PedagogicalEvaluator(client, reader, promptBuilder).propose(request);

        assertEquals(List.of("visual schedule", "shorter stations"), decision.adaptationRequirements());
        assertTrue(decision.feasibilityAdjustments().isEmpty());
        assertEquals(Verdict.REQUIRES_REVISION, decision.verdict());
        assertEquals(0.4, decision.score(), 1e-9);
        assertNull(decision.structure());
    }

    @Test
    @DisplayName("Feasibility evaluator keeps everything as adjustments")
    void feasibilityReply() {
        reply("{\"adjustments\": [\"extra time\"], \"adaptations\": [\"more adults\"], "
                + "\"verdict\": \"approved with adaptations\"}");

        ProposalDecision decision = new FeasibilityEvaluator(client, reader, promptBuilder).propose(request);

        assertEquals(List.of("extra time", "more adults"), decision.feasibilityAdjustments());
        assertEquals(Verdict.APPROVED_WITH_ADAPTATIONS, decision.verdict());
        assertEquals(0.65, decision.score(), 1e-9);
    }

    @Test
    @DisplayName("Unreadable reply raises a parse exception naming the collaborator")
    void unreadableReply() {
        reply("I would rather not.");

        var e = assertThrows(ProposalParseException.class,
                () -> new FeasibilityEvaluator(client, reader, promptBuilder).propose(request));
        assertEquals(FeasibilityEvaluator.ID, e.proposerId());
    }

    @Test
    @DisplayName("Generation failures propagate to the coordinator")
    void generationFailure() {
        when(client.generate(anyString(), anyInt(), any()))
                .thenThrow(new GenerationFailureException(GenerationFailureException.Kind.TIMEOUT, "slow"));

        assertThrows(GenerationFailureException.class,
                () -> new StructuralProposer(client, reader, promptBuilder).propose(request));
    }
}
