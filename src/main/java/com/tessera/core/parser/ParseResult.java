package com.tessera.core.parser;

import com.tessera.core.model.WorkItem;

import java.util.List;

/**
 * Normalized items plus how they were recovered.
 *
 * @param items        normalized work items, never empty
 * @param confidence   confidence of the winning strategy
 * @param strategyName the winning strategy
 * @param attempts     every strategy that ran, in order, winner last
 */
public record ParseResult(
    List<WorkItem> items,
    ParseConfidence confidence,
    String strategyName,
    List<StrategyAttempt> attempts
) {
    public ParseResult {
        items = List.copyOf(items);
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    public boolean degraded() {
        return confidence == ParseConfidence.FALLBACK;
    }
}
