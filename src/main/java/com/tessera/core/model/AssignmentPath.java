package com.tessera.core.model;

/**
 * Which route produced an assignment record.
 */
public enum AssignmentPath {
    EMPTY,
    OPTIMIZER,
    GREEDY
}
