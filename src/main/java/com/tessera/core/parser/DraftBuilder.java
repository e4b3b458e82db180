package com.tessera.core.parser;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItemDraft;
import com.tessera.core.normalize.FieldValues;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accumulates field values for one draft while a strategy walks the text.
 */
final class DraftBuilder {

    private final String id;
    private final StringBuilder description = new StringBuilder();
    private boolean describedByField;
    private int fieldCount;
    private Set<String> competencies;
    private Integer complexity;
    private CollaborationMode mode;
    private Set<String> dependencies;
    private Integer duration;
    private String stage;

    DraftBuilder(String id) {
        this.id = id;
    }

    void apply(DraftField field, String value) {
        fieldCount++;
        switch (field) {
            case DESCRIPTION -> {
                if (value != null && !value.isBlank()) {
                    appendDescription(value);
                    describedByField = true;
                }
            }
            case COMPETENCIES -> competencies = merge(competencies, FieldValues.splitList(value));
            case COMPLEXITY -> FieldValues.firstInteger(value).ifPresent(v -> complexity = v);
            case TYPE -> CollaborationMode.fromLabel(value).ifPresent(m -> mode = m);
            case DEPENDENCIES -> dependencies = merge(dependencies, FieldValues.splitList(value));
            case DURATION -> FieldValues.durationMinutes(value).ifPresent(v -> duration = v);
            case STAGE -> {
                if (value != null && !value.isBlank()) {
                    stage = value.trim();
                }
            }
        }
    }

    void appendDescription(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        if (description.length() > 0) {
            description.append(' ');
        }
        description.append(text.trim());
    }

    boolean describedByField() {
        return describedByField;
    }

    boolean hasDescription() {
        return description.length() > 0;
    }

    int fieldCount() {
        return fieldCount;
    }

    WorkItemDraft build() {
        String text = description.length() > 0 ? description.toString() : null;
        return new WorkItemDraft(id, text, competencies, complexity, mode, duration, dependencies, stage);
    }

    private static Set<String> merge(Set<String> current, Set<String> more) {
        var merged = current != null ? current : new LinkedHashSet<String>();
        merged.addAll(more);
        return merged;
    }
}
