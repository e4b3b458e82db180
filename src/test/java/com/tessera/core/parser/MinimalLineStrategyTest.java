package com.tessera.core.parser;

import com.tessera.core.model.WorkItemDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MinimalLineStrategyTest {

    @Test
    @DisplayName("Only lines with three words and fifteen characters survive")
    void plausibleLines() {
        var strategy = new MinimalLineStrategy(20);

        StrategyResult result = strategy.attempt("Go\nMeasure the desks carefully\n- Paint the big mural wall\nok ok ok",
                ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(2, result.drafts().size());
        assertEquals("Measure the desks carefully", result.drafts().get(0).description());
        assertEquals("Paint the big mural wall", result.drafts().get(1).description());
        assertNull(result.drafts().get(0).complexity());
    }

    @Test
    @DisplayName("Stops at the configured item cap")
    void capsItems() {
        var strategy = new MinimalLineStrategy(2);
        String text = "Measure the desks carefully\nPaint the big mural wall\nWrite a short closing story";

        assertEquals(2, strategy.attempt(text, ParseHints.none()).drafts().size());
    }

    @Test
    @DisplayName("Nothing plausible is a failure")
    void noPlausibleLines() {
        assertEquals(FailureReason.NO_MATCH, new MinimalLineStrategy(20).attempt("asdf qwer", ParseHints.none()).reason());
    }

    @Test
    @DisplayName("Canonical fallback always returns the three-stage plan")
    void canonicalFallback() {
        var fallback = new CanonicalFallbackStrategy();
        StrategyResult result = fallback.attempt(null, ParseHints.none());

        assertTrue(result.isSuccess());
        assertEquals(3, result.drafts().size());
        assertTrue(result.drafts().stream().allMatch(WorkItemDraft::hasDescription));
        assertEquals(ParseConfidence.FALLBACK, fallback.confidence());
    }
}
