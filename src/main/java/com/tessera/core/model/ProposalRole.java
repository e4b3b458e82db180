package com.tessera.core.model;

/**
 * The perspective a consensus collaborator speaks for.
 */
public enum ProposalRole {
    STRUCTURAL,
    PEDAGOGICAL,
    FEASIBILITY
}
