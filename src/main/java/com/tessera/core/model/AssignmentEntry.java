package com.tessera.core.model;

/**
 * One item given to one participant.
 *
 * @param itemId    canonical work item id
 * @param score     compatibility score in [0,1]
 * @param rationale human-readable reason for the placement
 */
public record AssignmentEntry(String itemId, double score, String rationale) {
}
