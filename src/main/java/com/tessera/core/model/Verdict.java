package com.tessera.core.model;

import java.util.Locale;

/**
 * A collaborator's judgement on an activity proposal.
 */
public enum Verdict {
    APPROVED,
    APPROVED_WITH_ADAPTATIONS,
    REQUIRES_REVISION;

    /**
     * Lenient reading of model output ("approved with adaptations", "requires-revision").
     * Unknown labels read as {@link #REQUIRES_REVISION}.
     */
    public static Verdict fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return REQUIRES_REVISION;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Verdict v : values()) {
            if (v.name().equals(normalized)) {
                return v;
            }
        }
        if (normalized.startsWith("APPROVED_WITH") || normalized.contains("ADAPT")) {
            return APPROVED_WITH_ADAPTATIONS;
        }
        if (normalized.startsWith("APPROVE")) {
            return APPROVED;
        }
        return REQUIRES_REVISION;
    }
}
