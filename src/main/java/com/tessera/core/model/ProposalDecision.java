package com.tessera.core.model;

import java.util.List;

/**
 * One collaborator's opinion in a consensus round.
 *
 * @param proposerId             collaborator identifier
 * @param role                   perspective the collaborator speaks for
 * @param structure              proposed activity structure
 * @param adaptationRequirements adaptations the proposal needs for the participant population
 * @param feasibilityAdjustments practical changes (time, materials, grouping)
 * @param verdict                overall judgement
 * @param score                  internal confidence score in [0,1]
 */
public record ProposalDecision(
    String proposerId,
    ProposalRole role,
    ProposalStructure structure,
    List<String> adaptationRequirements,
    List<String> feasibilityAdjustments,
    Verdict verdict,
    double score
) {
    public ProposalDecision {
        adaptationRequirements = adaptationRequirements != null ? List.copyOf(adaptationRequirements) : List.of();
        feasibilityAdjustments = feasibilityAdjustments != null ? List.copyOf(feasibilityAdjustments) : List.of();
        verdict = verdict != null ? verdict : Verdict.REQUIRES_REVISION;
        score = Math.max(0.0, Math.min(1.0, score));
    }
}
