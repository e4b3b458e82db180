package com.tessera.core.parser;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Field names recognised in generated item text, with the strict vocabulary and the
 * wider set of synonyms the tolerant strategy accepts.
 */
enum DraftField {
    DESCRIPTION,
    COMPETENCIES,
    COMPLEXITY,
    TYPE,
    DEPENDENCIES,
    DURATION,
    STAGE;

    private static final Map<String, DraftField> STRICT = Map.ofEntries(
            Map.entry("description", DESCRIPTION),
            Map.entry("descripción", DESCRIPTION),
            Map.entry("descripcion", DESCRIPTION),
            Map.entry("competencies", COMPETENCIES),
            Map.entry("competencias", COMPETENCIES),
            Map.entry("complexity", COMPLEXITY),
            Map.entry("complejidad", COMPLEXITY),
            Map.entry("type", TYPE),
            Map.entry("tipo", TYPE),
            Map.entry("dependencies", DEPENDENCIES),
            Map.entry("dependencias", DEPENDENCIES),
            Map.entry("duration", DURATION),
            Map.entry("time", DURATION),
            Map.entry("tiempo", DURATION),
            Map.entry("duración", DURATION),
            Map.entry("duracion", DURATION),
            Map.entry("stage", STAGE),
            Map.entry("phase", STAGE),
            Map.entry("fase", STAGE)
    );

    private static final Map<String, DraftField> SYNONYMS = Map.ofEntries(
            Map.entry("title", DESCRIPTION),
            Map.entry("name", DESCRIPTION),
            Map.entry("task", DESCRIPTION),
            Map.entry("activity", DESCRIPTION),
            Map.entry("details", DESCRIPTION),
            Map.entry("título", DESCRIPTION),
            Map.entry("titulo", DESCRIPTION),
            Map.entry("nombre", DESCRIPTION),
            Map.entry("skills", COMPETENCIES),
            Map.entry("skill", COMPETENCIES),
            Map.entry("competences", COMPETENCIES),
            Map.entry("competency", COMPETENCIES),
            Map.entry("abilities", COMPETENCIES),
            Map.entry("habilidades", COMPETENCIES),
            Map.entry("difficulty", COMPLEXITY),
            Map.entry("level", COMPLEXITY),
            Map.entry("nivel", COMPLEXITY),
            Map.entry("dificultad", COMPLEXITY),
            Map.entry("mode", TYPE),
            Map.entry("grouping", TYPE),
            Map.entry("modality", TYPE),
            Map.entry("format", TYPE),
            Map.entry("modalidad", TYPE),
            Map.entry("agrupamiento", TYPE),
            Map.entry("requires", DEPENDENCIES),
            Map.entry("depends on", DEPENDENCIES),
            Map.entry("prerequisites", DEPENDENCIES),
            Map.entry("after", DEPENDENCIES),
            Map.entry("requisitos", DEPENDENCIES),
            Map.entry("minutes", DURATION),
            Map.entry("estimated time", DURATION),
            Map.entry("length", DURATION),
            Map.entry("minutos", DURATION),
            Map.entry("step", STAGE),
            Map.entry("etapa", STAGE)
    );

    static Optional<DraftField> strict(String key) {
        return Optional.ofNullable(STRICT.get(normalizeKey(key)));
    }

    static Optional<DraftField> tolerant(String key) {
        String k = normalizeKey(key);
        DraftField field = STRICT.get(k);
        return Optional.ofNullable(field != null ? field : SYNONYMS.get(k));
    }

    private static String normalizeKey(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
