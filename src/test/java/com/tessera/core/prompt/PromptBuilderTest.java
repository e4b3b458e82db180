package com.tessera.core.prompt;

import com.tessera.core.consensus.ConsensusRequest;
import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.WorkItem;
import com.tessera.core.retrieval.ActivityExample;
import com.tessera.core.retrieval.RankedExample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromptBuilderTest {

    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PromptBuilder();
    }

    @Test
    @DisplayName("decomposition prompt carries the intent, item limit and field format")
    void decompositionPrompt() {
        String prompt = builder.decompositionPrompt("  Build a bridge with straws  ", List.of(), null, 8);

        assertTrue(prompt.contains("between 3 and 8 atomic tasks"));
        assertTrue(prompt.contains("ACTIVITY:\nBuild a bridge with straws\n"));
        assertTrue(prompt.contains("Competencies:"));
        assertFalse(prompt.contains("AGREED STRUCTURE"));
        assertFalse(prompt.contains("SIMILAR ACTIVITIES"));
    }

    @Test
    @DisplayName("decomposition prompt includes the agreed structure and similar examples")
    void decompositionPromptWithContext() {
        var structure = new ProposalStructure("stations", List.of("setup", "rotation"), CollaborationMode.PAIR, 6, "");
        var example = new RankedExample(new ActivityExample("EX-1", "Water cycle", "Heat water",
                List.of("preparation", "execution"), List.of()), 0.4);

        String prompt = builder.decompositionPrompt("Water experiment", List.of(example), structure, 20);

        assertTrue(prompt.contains("Type: stations"));
        assertTrue(prompt.contains("Stages: setup, rotation"));
        assertTrue(prompt.contains("Preferred mode: pair"));
        assertTrue(prompt.contains("Suggested number of tasks: 6"));
        assertTrue(prompt.contains("- Water cycle: Heat water (stages: preparation, execution)"));
    }

    @Test
    @DisplayName("replay prompt asks to decompose from scratch when there is no previous text")
    void replayPrompt() {
        String withText = builder.replayPrompt("Garden", "some garbled reply", "FORMAT", null);
        String withoutText = builder.replayPrompt("Garden", "  ", "FORMAT", null);

        assertTrue(withText.contains("PREVIOUS TEXT:\nsome garbled reply"));
        assertTrue(withText.endsWith("FORMAT"));
        assertTrue(withoutText.contains("decompose the activity from scratch"));
        assertFalse(withoutText.contains("PREVIOUS TEXT"));
    }

    @Test
    @DisplayName("optimizer prompt lists local task ids and participants")
    void optimizerPrompt() {
        var items = new LinkedHashMap<String, WorkItem>();
        items.put("task_01", new WorkItem("ITEM-001", "Measure straws", Set.of("precision"), 2,
                CollaborationMode.INDIVIDUAL, 15, Set.of(), "preparation"));
        var participant = new ParticipantProfile("P1", "Alex", Set.of("precision"), Set.of(), Neurotype.ASD, 90,
                List.of(), null);

        String prompt = builder.optimizerPrompt(items, List.of(participant), new PreferenceWeights(0.8, 0.2, 0.5));

        assertTrue(prompt.contains("- task_01: Measure straws [competencies: precision; complexity 2; individual]"));
        assertTrue(prompt.contains("- P1 (Alex): strengths precision; support needs none; availability 90"));
        assertTrue(prompt.contains("structure 0.8, collaboration 0.2, flexibility 0.5"));
        assertFalse(prompt.contains("ITEM-001"));
    }

    @Test
    @DisplayName("neutral weights are left out of prompts")
    void neutralWeightsOmitted() {
        var request = new ConsensusRequest("Debate", "", PreferenceWeights.NEUTRAL, null, 0);

        assertFalse(builder.collaboratorPrompt(ProposalRole.FEASIBILITY, request).contains("PREFERENCES"));
    }

    @Test
    @DisplayName("collaborator prompt is role specific and always asks for JSON")
    void collaboratorPrompt() {
        var request = new ConsensusRequest("Debate on recycling", "4 participants", null, null, 0);

        String structural = builder.collaboratorPrompt(ProposalRole.STRUCTURAL, request);
        String pedagogical = builder.collaboratorPrompt(ProposalRole.PEDAGOGICAL, request);

        assertTrue(structural.contains("Propose a structure"));
        assertTrue(pedagogical.contains("inclusive pedagogy"));
        assertTrue(pedagogical.contains("PARTICIPANTS:\n4 participants"));
        assertTrue(structural.contains("\"activity_type\""));
        assertTrue(pedagogical.contains("\"verdict\""));
    }
}
