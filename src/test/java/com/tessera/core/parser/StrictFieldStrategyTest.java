package com.tessera.core.parser;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItemDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StrictFieldStrategyTest {

    private final StrictFieldStrategy strategy = new StrictFieldStrategy();

    @Test
    @DisplayName("Reads TASK blocks in the prompted format")
    void readsTaskBlocks() {
        String text = """
                TASK 1: Prepare the lab
                Description: Prepare the materials for the experiment
                Competencies: organization, precision
                Complexity: 2
                Type: individual
                Dependencies: none
                Duration: 20 minutes
                Stage: preparation

                TASK 2: Run the experiment
                Description: Run the water experiment in groups
                Competencies: research, collaboration
                Complexity: 4
                Type: group
                Dependencies: task 1
                Duration: 45 minutes
                Stage: execution
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        WorkItemDraft first = result.drafts().get(0);
        assertEquals("task 1", first.id());
        assertEquals("Prepare the materials for the experiment", first.description());
        assertEquals(Set.of("organization", "precision"), first.requiredCompetencies());
        assertEquals(2, first.complexity());
        assertEquals(CollaborationMode.INDIVIDUAL, first.collaborationMode());
        assertEquals(20, first.estimatedDurationMinutes());
        assertEquals("preparation", first.stage());
        assertTrue(first.dependencies().isEmpty());

        WorkItemDraft second = result.drafts().get(1);
        assertEquals("task 2", second.id());
        assertEquals(CollaborationMode.GROUP, second.collaborationMode());
        assertEquals(Set.of("task 1"), second.dependencies());
    }

    @Test
    @DisplayName("Header title stands in for a missing description field")
    void titleAsDescription() {
        StrategyResult result = strategy.attempt("TASK 1: Measure the classroom\nComplexity: 3", ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals("Measure the classroom", result.drafts().get(0).description());
    }

    @Test
    @DisplayName("Blank-line separated field blocks are read without headers")
    void blankLineBlocks() {
        String text = """
                Description: Draw a map of the school
                Type: individual

                Description: Present the map to a partner
                Type: pair
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals("2", result.drafts().get(1).id());
        assertEquals(CollaborationMode.PAIR, result.drafts().get(1).collaborationMode());
    }

    @Test
    @DisplayName("Any unknown line inside a block rejects the text")
    void unknownLineRejects() {
        String text = """
                TASK 1: Something
                Description: Do it
                Notes: whatever
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertFalse(result.isSuccess());
        assertEquals(FailureReason.NO_MATCH, result.reason());
    }

    @Test
    @DisplayName("Header without any field is not a strict block")
    void headerWithoutFields() {
        StrategyResult result = strategy.attempt("TASK 1: Do things\nTASK 2: More things", ParseHints.none());
        assertEquals(FailureReason.NO_MATCH, result.reason());
    }

    @Test
    @DisplayName("Header numbers beyond the int range are kept as written")
    void oversizedHeaderNumber() {
        String text = """
                TASK 99999999999: Measure
                Description: Measure the room
                Complexity: 4
                """;

        StrategyResult result = strategy.attempt(text, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(1, result.drafts().size());
        assertEquals("task 99999999999", result.drafts().get(0).id());
        assertEquals(4, result.drafts().get(0).complexity());
    }

    @Test
    @DisplayName("Leading zeros in a header number are dropped")
    void zeroPaddedHeaderNumber() {
        StrategyResult result = strategy.attempt("TASK 007:\nDescription: Sort the samples", ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals("task 7", result.drafts().get(0).id());
    }

    @Test
    @DisplayName("Prose and empty input are rejected")
    void proseAndEmpty() {
        assertEquals(FailureReason.NO_MATCH, strategy.attempt("Here is a plan for you", ParseHints.none()).reason());
        assertEquals(FailureReason.EMPTY_INPUT, strategy.attempt("   ", ParseHints.none()).reason());
        assertEquals(FailureReason.EMPTY_INPUT, strategy.attempt(null, ParseHints.none()).reason());
    }
}
