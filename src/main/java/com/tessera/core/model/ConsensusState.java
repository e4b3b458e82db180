package com.tessera.core.model;

/**
 * States of the consensus state machine. {@link #DECIDED} and {@link #FALLBACK} are terminal.
 */
public enum ConsensusState {
    COLLECTING,
    EVALUATING,
    DECIDED,
    FALLBACK;

    public boolean isTerminal() {
        return this == DECIDED || this == FALLBACK;
    }
}
