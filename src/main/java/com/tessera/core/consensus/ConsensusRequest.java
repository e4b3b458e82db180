package com.tessera.core.consensus;

import com.tessera.core.model.PreferenceWeights;

import java.time.Duration;

/**
 * What every collaborator sees when asked for an opinion.
 *
 * @param intent             the activity intent
 * @param participantSummary short description of the participant population
 * @param weights            requester preference weights
 * @param timeout            per-call timeout
 * @param maxTokens          per-call token budget
 */
public record ConsensusRequest(
    String intent,
    String participantSummary,
    PreferenceWeights weights,
    Duration timeout,
    int maxTokens
) {
    public ConsensusRequest {
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("Consensus needs an intent");
        }
        participantSummary = participantSummary != null ? participantSummary : "";
        weights = weights != null ? weights : PreferenceWeights.NEUTRAL;
        timeout = timeout != null ? timeout : Duration.ofSeconds(60);
        maxTokens = maxTokens > 0 ? maxTokens : 800;
    }
}
