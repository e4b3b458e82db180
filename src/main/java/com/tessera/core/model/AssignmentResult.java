package com.tessera.core.model;

import java.util.List;

/**
 * Assignment record plus how it was reached.
 *
 * @param record   the assignment itself
 * @param path     which path produced it
 * @param degraded true when the optimizer path was attempted and abandoned
 * @param notes    validation notes (dropped ids, remappings, fallbacks)
 */
public record AssignmentResult(
    AssignmentRecord record,
    AssignmentPath path,
    boolean degraded,
    List<String> notes
) {
    public AssignmentResult {
        notes = notes != null ? List.copyOf(notes) : List.of();
    }

    public static AssignmentResult empty() {
        return new AssignmentResult(AssignmentRecord.empty(), AssignmentPath.EMPTY, false, List.of());
    }
}
