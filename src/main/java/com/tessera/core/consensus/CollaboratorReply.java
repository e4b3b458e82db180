package com.tessera.core.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON a collaborator is asked to answer with. Every field is optional.
 */
public record CollaboratorReply(
    @JsonProperty("activity_type") String activityType,
    List<String> stages,
    @JsonProperty("collaboration_mode") String collaborationMode,
    @JsonProperty("suggested_item_count") Integer suggestedItemCount,
    String summary,
    List<String> adaptations,
    List<String> adjustments,
    String verdict,
    Double score
) {

    boolean describesStructure() {
        return (activityType != null && !activityType.isBlank()) || (stages != null && !stages.isEmpty());
    }
}
