package com.tessera.core.parser;

/**
 * One entry of the chain's audit trail.
 *
 * @param strategyName the strategy that ran
 * @param reason       why it was rejected, or null for the winner
 * @param detail       log detail, may be null
 */
public record StrategyAttempt(String strategyName, FailureReason reason, String detail) {

    public boolean succeeded() {
        return reason == null;
    }
}
