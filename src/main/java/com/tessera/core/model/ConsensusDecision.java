package com.tessera.core.model;

import java.util.List;

/**
 * Merged outcome of the three consensus collaborators.
 *
 * @param type                   how the decision was reached
 * @param finalState             terminal state of the machine
 * @param structure              activity structure to request work items for
 * @param adaptationRequirements merged adaptations, first-seen order
 * @param feasibilityAdjustments merged adjustments, first-seen order
 * @param verdict                merged verdict
 * @param weightedScore          combined score in [0,1]
 * @param contributors           proposer ids whose opinions shaped the decision
 * @param failures               "proposerId: message" for each failed collaborator
 * @param stateTrail             states visited, in order
 * @param degraded               true for every fallback decision
 */
public record ConsensusDecision(
    DecisionType type,
    ConsensusState finalState,
    ProposalStructure structure,
    List<String> adaptationRequirements,
    List<String> feasibilityAdjustments,
    Verdict verdict,
    double weightedScore,
    List<String> contributors,
    List<String> failures,
    List<ConsensusState> stateTrail,
    boolean degraded
) {
    public ConsensusDecision {
        adaptationRequirements = List.copyOf(adaptationRequirements);
        feasibilityAdjustments = List.copyOf(feasibilityAdjustments);
        contributors = List.copyOf(contributors);
        failures = List.copyOf(failures);
        stateTrail = List.copyOf(stateTrail);
    }
}
