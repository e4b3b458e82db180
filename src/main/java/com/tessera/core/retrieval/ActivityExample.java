package com.tessera.core.retrieval;

import java.util.List;

/**
 * One entry of the example catalog.
 *
 * @param id          catalog id
 * @param title       short title
 * @param description what the activity is
 * @param stages      stage labels, in order
 * @param tags        free keywords
 */
public record ActivityExample(String id, String title, String description, List<String> stages, List<String> tags) {

    public ActivityExample {
        title = title != null ? title : "";
        description = description != null ? description : "";
        stages = stages != null ? List.copyOf(stages) : List.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }
}
