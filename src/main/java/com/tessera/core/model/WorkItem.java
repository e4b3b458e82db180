package com.tessera.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An atomic, assignable unit of activity work, as produced by the normalizer.
 *
 * @param id                       batch-unique identifier (e.g., "ITEM-001")
 * @param description              what the participant does; never blank
 * @param requiredCompetencies     lower-case competency tags, in inference order
 * @param complexity               1 (trivial) to 5 (very demanding)
 * @param collaborationMode        individual, pair or group work
 * @param estimatedDurationMinutes positive duration estimate
 * @param dependencies             ids of items in the same batch that come first
 * @param stage                    free-text phase label (preparation, execution, reflection, ...)
 */
public record WorkItem(
    String id,
    String description,
    Set<String> requiredCompetencies,
    int complexity,
    CollaborationMode collaborationMode,
    int estimatedDurationMinutes,
    Set<String> dependencies,
    String stage
) {

    public static final int MIN_COMPLEXITY = 1;
    public static final int MAX_COMPLEXITY = 5;

    public WorkItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("WorkItem id must not be blank");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("WorkItem " + id + " has a blank description");
        }
        if (complexity < MIN_COMPLEXITY || complexity > MAX_COMPLEXITY) {
            throw new IllegalArgumentException("WorkItem " + id + " complexity out of range: " + complexity);
        }
        if (estimatedDurationMinutes <= 0) {
            throw new IllegalArgumentException("WorkItem " + id + " duration must be positive");
        }
        if (collaborationMode == null) {
            throw new IllegalArgumentException("WorkItem " + id + " has no collaboration mode");
        }
        requiredCompetencies = orderedCopy(requiredCompetencies);
        dependencies = orderedCopy(dependencies);
    }

    public boolean hasCompetency(String tag) {
        return requiredCompetencies.contains(tag);
    }

    private static Set<String> orderedCopy(Set<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
