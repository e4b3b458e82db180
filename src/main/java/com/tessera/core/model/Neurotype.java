package com.tessera.core.model;

import java.util.Locale;

/**
 * Support-need classification that drives scoring bonuses and penalties.
 */
public enum Neurotype {
    TYPICAL,
    ASD,
    ADHD,
    GIFTED,
    OTHER;

    /**
     * Reads a diagnostic category as it appears in participant files
     * ("TEA_nivel_1", "TDAH_combinado", "altas_capacidades", "ninguno", "ASD", ...).
     */
    public static Neurotype fromDiagnosticCategory(String category) {
        if (category == null || category.isBlank()) {
            return TYPICAL;
        }
        String upper = category.toUpperCase(Locale.ROOT).trim();
        if (upper.startsWith("TEA") || upper.startsWith("ASD") || upper.contains("AUTIS")) {
            return ASD;
        }
        if (upper.startsWith("TDAH") || upper.startsWith("ADHD")) {
            return ADHD;
        }
        if (upper.contains("ALTAS_CAPACIDADES") || upper.contains("ALTAS CAPACIDADES") || upper.startsWith("GIFTED")) {
            return GIFTED;
        }
        if (upper.equals("NONE") || upper.equals("NINGUNO") || upper.equals("TYPICAL") || upper.equals("TIPICO")) {
            return TYPICAL;
        }
        return OTHER;
    }
}
