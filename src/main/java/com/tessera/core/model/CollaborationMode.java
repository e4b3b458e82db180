package com.tessera.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How participants work on a single work item.
 */
public enum CollaborationMode {
    INDIVIDUAL,
    PAIR,
    GROUP;

    /**
     * Maps a free-text label from generated output ("colaborativa", "team work", "pairs")
     * onto a mode. Returns empty when the label names none of them.
     */
    public static Optional<CollaborationMode> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String lower = label.toLowerCase(Locale.ROOT).trim();
        if (lower.contains("pair") || lower.contains("pareja") || lower.contains("partner")) {
            return Optional.of(PAIR);
        }
        if (lower.contains("group") || lower.contains("grupo") || lower.contains("team")
                || lower.contains("equipo") || lower.contains("collab") || lower.contains("colab")) {
            return Optional.of(GROUP);
        }
        if (lower.contains("individual") || lower.contains("solo") || lower.contains("creativ")) {
            return Optional.of(INDIVIDUAL);
        }
        return Optional.empty();
    }
}
