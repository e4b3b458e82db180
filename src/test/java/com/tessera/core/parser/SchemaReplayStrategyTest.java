package com.tessera.core.parser;

import com.tessera.core.llm.GenerationFailureException;
import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.CollaborationMode;
import com.tessera.core.prompt.PromptBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SchemaReplayStrategyTest {

    private TextGenerationClient client;
    private SchemaReplayStrategy strategy;
    private ParseHints hints;

    @BeforeEach
    void setUp() {
        client = mock(TextGenerationClient.class);
        strategy = new SchemaReplayStrategy(client, new JsonResponseReader(), new PromptBuilder());
        hints = new ParseHints("Build a volcano model", true, Duration.ofSeconds(5), 400, null);
    }

    @Test
    @DisplayName("Disabled replay never calls the text service")
    void disabled() {
        StrategyResult result = strategy.attempt("garbage", ParseHints.none());

        assertEquals(FailureReason.REPLAY_DISABLED, result.reason());
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Replay without an intent is unavailable")
    void noIntent() {
        var noIntent = new ParseHints(" ", true, Duration.ofSeconds(5), 400, null);

        assertEquals(FailureReason.REPLAY_UNAVAILABLE, strategy.attempt("garbage", noIntent).reason());
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("JSON payload reply becomes drafts")
    void jsonPayload() {
        when(client.generate(anyString(), anyInt(), any())).thenReturn("""
                ```json
                {"items": [
                  {"id": "TASK 1", "description": "Gather clay and paint", "competencies": ["organization"],
                   "complexity": 2, "type": "individual", "dependencies": [], "durationMinutes": 15,
                   "stage": "preparation"},
                  {"id": "TASK 2", "description": "Shape the volcano in groups", "type": "group",
                   "dependencies": ["TASK 1"]}
                ]}
                ```
                """);

        StrategyResult result = strategy.attempt("garbage", hints);

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals(Set.of("organization"), result.drafts().get(0).requiredCompetencies());
        assertEquals(15, result.drafts().get(0).estimatedDurationMinutes());
        assertEquals(CollaborationMode.GROUP, result.drafts().get(1).collaborationMode());
        assertEquals(Set.of("TASK 1"), result.drafts().get(1).dependencies());
        verify(client, times(1)).generate(contains("Build a volcano model"), eq(400), eq(Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("Bare JSON array reply is accepted")
    void jsonArray() {
        when(client.generate(anyString(), anyInt(), any()))
                .thenReturn("[{\"description\": \"Draw a map\"}, {\"description\": \"Label the rivers\"}]");

        StrategyResult result = strategy.attempt("garbage", hints);

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals("Label the rivers", result.drafts().get(1).description());
    }

    @Test
    @DisplayName("Strict field reply is accepted when it is not JSON")
    void strictFieldReply() {
        when(client.generate(anyString(), anyInt(), any()))
                .thenReturn("TASK 1:\nDescription: Mix the baking soda\nType: pair");

        StrategyResult result = strategy.attempt("garbage", hints);

        assertTrue(result.isSuccess());
        assertEquals("Mix the baking soda", result.drafts().get(0).description());
    }

    @Test
    @DisplayName("Generation failure is reported, not thrown, after one call")
    void generationFailure() {
        when(client.generate(anyString(), anyInt(), any()))
                .thenThrow(new GenerationFailureException(GenerationFailureException.Kind.TIMEOUT, "timed out"));

        StrategyResult result = strategy.attempt("garbage", hints);

        assertEquals(FailureReason.GENERATION_FAILED, result.reason());
        verify(client, times(1)).generate(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("Unreadable reply is a no-match")
    void unreadableReply() {
        when(client.generate(anyString(), anyInt(), any())).thenReturn("I cannot help with that");

        assertEquals(FailureReason.NO_MATCH, strategy.attempt("garbage", hints).reason());
    }
}
