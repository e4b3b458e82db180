package com.tessera.core.model;

import java.util.List;

/**
 * What kind of activity a collaborator proposes.
 *
 * @param activityType       short label (e.g., "stations", "project", "debate")
 * @param stages             ordered stage labels
 * @param collaborationMode  dominant mode, may be null
 * @param suggestedItemCount how many work items to request, 0 when unspecified
 * @param summary            one-paragraph description
 */
public record ProposalStructure(
    String activityType,
    List<String> stages,
    CollaborationMode collaborationMode,
    int suggestedItemCount,
    String summary
) {

    public static final ProposalStructure CANONICAL = new ProposalStructure(
            "generic",
            List.of("preparation", "execution", "reflection"),
            CollaborationMode.GROUP,
            3,
            "Prepare the activity, carry it out together, then reflect on the outcome.");

    public ProposalStructure {
        stages = stages != null ? List.copyOf(stages) : List.of();
        suggestedItemCount = Math.max(0, suggestedItemCount);
    }
}
