package com.tessera.core.engine;

import com.tessera.core.model.PreferenceWeights;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable per-request settings, threaded through the pipeline.
 *
 * @param requestId  e.g. "PLAN-2026-0001"
 * @param intent     the activity intent
 * @param weights    requester preference weights
 * @param timeout    per-call timeout for the text service
 * @param maxTokens  per-call token budget
 * @param startedAt  when the request started
 */
public record RequestContext(
    String requestId,
    String intent,
    PreferenceWeights weights,
    Duration timeout,
    int maxTokens,
    Instant startedAt
) {
    public RequestContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be blank");
        }
        intent = intent != null ? intent : "";
        weights = weights != null ? weights : PreferenceWeights.NEUTRAL;
        startedAt = startedAt != null ? startedAt : Instant.now();
    }

    /**
     * Short stable fingerprint of the intent, for correlating logs without printing it.
     */
    public String intentHash() {
        return String.format("%08x", intent.strip().hashCode());
    }
}
