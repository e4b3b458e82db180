package com.tessera.core.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TolerantStructuralStrategyTest {

    private final TolerantStructuralStrategy strategy = new TolerantStructuralStrategy();

    @Test
    @DisplayName("Numbered list with synonym detail lines")
    void numberedListWithDetails() {
        String text = """
                Here is the plan:
                1. Gather the materials for the model
                   - Difficulty: 2
                   - Skills: organization
                2. Build the model in teams
                   - Difficulty: 4
                3. Present the model to the class
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(3, result.drafts().size());
        assertEquals("Gather the materials for the model", result.drafts().get(0).description());
        assertEquals(2, result.drafts().get(0).complexity());
        assertEquals(Set.of("organization"), result.drafts().get(0).requiredCompetencies());
        assertEquals(4, result.drafts().get(1).complexity());
        assertNull(result.drafts().get(2).complexity());
    }

    @Test
    @DisplayName("A markdown title above a bullet list is not an item")
    void headerWithoutFieldsDropped() {
        String text = """
                # Science Fair Plan
                - Research a topic in the library
                - Design the poster with drawings
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals("Research a topic in the library", result.drafts().get(0).description());
    }

    @Test
    @DisplayName("Bold titles with field lines become items")
    void boldTitles() {
        String text = """
                **Warm-up game**
                Duration: 10 minutes
                **Main experiment**
                Duration: 40 minutes
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals("Warm-up game", result.drafts().get(0).description());
        assertEquals(10, result.drafts().get(0).estimatedDurationMinutes());
        assertEquals(40, result.drafts().get(1).estimatedDurationMinutes());
    }

    @Test
    @DisplayName("A single bare entry or plain prose is not a plan")
    void rejectsBareText() {
        assertEquals(FailureReason.NO_MATCH,
                strategy.attempt("- Just one thing to do here", ParseHints.none()).reason());
        assertEquals(FailureReason.NO_MATCH,
                strategy.attempt("This is simply a paragraph of text without structure.", ParseHints.none()).reason());
        assertEquals(FailureReason.EMPTY_INPUT, strategy.attempt("", ParseHints.none()).reason());
    }

    @Test
    @DisplayName("An oversized header number does not break the item")
    void oversizedHeaderNumber() {
        String text = """
                Task 123456789012345678901234567890 - Label the diagram
                   - Difficulty: 3
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals("task 123456789012345678901234567890", result.drafts().get(0).id());
    }
}
