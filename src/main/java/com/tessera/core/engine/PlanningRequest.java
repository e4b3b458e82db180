package com.tessera.core.engine;

import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.participant.ParticipantRecord;

import java.time.Duration;
import java.util.List;

/**
 * One planning request.
 *
 * @param intent       free-form activity intent
 * @param weights      preference weights, null for neutral
 * @param participants participants for this request only, null to use the loaded repository
 * @param consensus    whether to run the consensus round first
 * @param timeout      per-call timeout, null for the configured default
 */
public record PlanningRequest(
    String intent,
    PreferenceWeights weights,
    List<ParticipantRecord> participants,
    boolean consensus,
    Duration timeout
) {
    public PlanningRequest {
        if (intent == null || intent.isBlank()) {
            throw new IllegalArgumentException("Activity intent must not be blank");
        }
        participants = participants != null ? List.copyOf(participants) : null;
    }

    public static PlanningRequest of(String intent) {
        return new PlanningRequest(intent, null, null, true, null);
    }
}
