package com.tessera.core.normalize;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.WorkItem;
import com.tessera.core.model.WorkItemDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns parser drafts into well-formed {@link WorkItem}s.
 * <p>
 * Ids are positional ({@code ITEM-001}, {@code ITEM-002}, ...) so that two runs over the same
 * drafts produce the same batch. Every default is derived from the draft itself; the
 * normalizer holds no state and can be shared freely.
 */
@Component
public class WorkItemNormalizer {

    private static final Logger log = LoggerFactory.getLogger(WorkItemNormalizer.class);

    public static final int DEFAULT_COMPLEXITY = 3;
    static final int MINUTES_PER_COMPLEXITY = 12;
    static final int MIN_DEFAULT_DURATION = 15;
    static final int MAX_DEFAULT_DURATION = 60;

    public static String idFor(int ordinal) {
        return String.format("ITEM-%03d", ordinal);
    }

    /**
     * Normalizes a single draft. Dependency references are kept as written apart from
     * blanks and self-references; use {@link #normalizeBatch} to resolve them.
     *
     * @throws IllegalArgumentException if the draft has no description
     */
    public WorkItem normalize(WorkItemDraft draft, int ordinal) {
        if (draft == null || !draft.hasDescription()) {
            throw new IllegalArgumentException("Draft " + ordinal + " has no description");
        }
        String id = idFor(ordinal);
        var deps = new LinkedHashSet<String>();
        if (draft.dependencies() != null) {
            for (String ref : draft.dependencies()) {
                if (ref != null && !ref.isBlank() && !ref.trim().equals(id)) {
                    deps.add(ref.trim());
                }
            }
        }
        return build(draft, id, deps);
    }

    /**
     * Normalizes drafts in order, assigning ordinals from 1 and resolving dependency
     * references to canonical ids. A reference resolves when it names a draft id, a
     * canonical id, an ordinal ("2", "task 2") or a stage label; anything else is dropped.
     */
    public List<WorkItem> normalizeBatch(List<WorkItemDraft> drafts) {
        if (drafts == null || drafts.isEmpty()) {
            return List.of();
        }
        int n = drafts.size();
        var provisional = new ArrayList<WorkItem>(n);
        for (int i = 0; i < n; i++) {
            provisional.add(build(requireDescribed(drafts.get(i), i + 1), idFor(i + 1), Set.of()));
        }

        Map<String, String> lookup = new HashMap<>();
        for (int i = 0; i < n; i++) {
            String canonical = provisional.get(i).id();
            lookup.putIfAbsent(key(canonical), canonical);
            String draftId = drafts.get(i).id();
            if (draftId != null && !draftId.isBlank()) {
                lookup.putIfAbsent(key(draftId), canonical);
            }
        }
        for (int i = 0; i < n; i++) {
            lookup.putIfAbsent(key(provisional.get(i).stage()), provisional.get(i).id());
        }

        var items = new ArrayList<WorkItem>(n);
        for (int i = 0; i < n; i++) {
            WorkItem item = provisional.get(i);
            var resolved = new LinkedHashSet<String>();
            Set<String> refs = drafts.get(i).dependencies();
            if (refs != null) {
                for (String ref : refs) {
                    resolve(ref, lookup, n).ifPresentOrElse(target -> {
                        if (target.equals(item.id())) {
                            log.debug("Dropping self-dependency on {}", item.id());
                        } else {
                            resolved.add(target);
                        }
                    }, () -> log.warn("Dropping unknown dependency '{}' of {}", ref, item.id()));
                }
            }
            items.add(new WorkItem(item.id(), item.description(), item.requiredCompetencies(),
                    item.complexity(), item.collaborationMode(), item.estimatedDurationMinutes(),
                    resolved, item.stage()));
        }
        log.debug("Normalized {} drafts", n);
        return List.copyOf(items);
    }

    private WorkItem build(WorkItemDraft draft, String id, Set<String> dependencies) {
        String description = draft.description().trim();
        int complexity = draft.complexity() == null
                ? DEFAULT_COMPLEXITY
                : clamp(draft.complexity(), WorkItem.MIN_COMPLEXITY, WorkItem.MAX_COMPLEXITY);
        CollaborationMode mode = draft.collaborationMode() != null
                ? draft.collaborationMode()
                : KeywordTable.inferMode(description).orElse(CollaborationMode.INDIVIDUAL);
        int duration = draft.estimatedDurationMinutes() != null && draft.estimatedDurationMinutes() > 0
                ? Math.min(draft.estimatedDurationMinutes(), FieldValues.MAX_DURATION_MINUTES)
                : clamp(complexity * MINUTES_PER_COMPLEXITY, MIN_DEFAULT_DURATION, MAX_DEFAULT_DURATION);
        Set<String> competencies = FieldValues.normalizeTags(draft.requiredCompetencies());
        if (competencies.isEmpty()) {
            competencies = KeywordTable.inferCompetencies(description);
        }
        String stage = draft.stage() != null && !draft.stage().isBlank()
                ? draft.stage().trim().toLowerCase(Locale.ROOT)
                : KeywordTable.inferStage(description);
        return new WorkItem(id, description, competencies, complexity, mode, duration, dependencies, stage);
    }

    private static WorkItemDraft requireDescribed(WorkItemDraft draft, int ordinal) {
        if (draft == null || !draft.hasDescription()) {
            throw new IllegalArgumentException("Draft " + ordinal + " has no description");
        }
        return draft;
    }

    private static Optional<String> resolve(String ref, Map<String, String> lookup, int size) {
        if (ref == null || ref.isBlank() || FieldValues.isNone(ref)) {
            return Optional.empty();
        }
        String direct = lookup.get(key(ref));
        if (direct != null) {
            return Optional.of(direct);
        }
        return FieldValues.trailingOrdinal(ref)
                .filter(ordinal -> ordinal >= 1 && ordinal <= size)
                .map(WorkItemNormalizer::idFor);
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
