package com.tessera.core.model;

/**
 * Outcome class of a consensus round.
 */
public enum DecisionType {
    /** Weighted merge of all three opinions. */
    CONSENSUS,
    /** The pedagogical evaluation rejected the proposal and dominates. */
    MODIFICATION_PEDAGOGICAL,
    /** A collaborator failed; the best single opinion was used. */
    FALLBACK
}
