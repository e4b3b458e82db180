package com.tessera.core.model;

import java.util.Set;

/**
 * A work item as a parser strategy recovered it. Every field except the description
 * may be missing; the normalizer fills the gaps.
 *
 * @param id                       the strategy's own identifier, used only to resolve dependencies
 * @param description              item text
 * @param requiredCompetencies     competency tags, or null when the text named none
 * @param complexity               1-5 as written, or null
 * @param collaborationMode        mode as written, or null
 * @param estimatedDurationMinutes minutes as written, or null
 * @param dependencies             references to other drafts (ids, ordinals, stage names), or null
 * @param stage                    phase label, or null
 */
public record WorkItemDraft(
    String id,
    String description,
    Set<String> requiredCompetencies,
    Integer complexity,
    CollaborationMode collaborationMode,
    Integer estimatedDurationMinutes,
    Set<String> dependencies,
    String stage
) {

    public static WorkItemDraft describing(String description) {
        return new WorkItemDraft(null, description, null, null, null, null, null, null);
    }

    public static WorkItemDraft of(WorkItem item) {
        return new WorkItemDraft(item.id(), item.description(), item.requiredCompetencies(),
                item.complexity(), item.collaborationMode(), item.estimatedDurationMinutes(),
                item.dependencies(), item.stage());
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    public WorkItemDraft withId(String newId) {
        return new WorkItemDraft(newId, description, requiredCompetencies, complexity,
                collaborationMode, estimatedDurationMinutes, dependencies, stage);
    }
}
