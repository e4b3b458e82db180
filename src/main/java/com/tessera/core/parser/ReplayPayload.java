package com.tessera.core.parser;

import java.util.List;

/**
 * JSON shape requested from the text service during schema replay.
 *
 * @param items the tasks, in order
 */
public record ReplayPayload(List<Item> items) {

    /**
     * @param id              short task id, e.g. "TASK 1"
     * @param description     what the participant does
     * @param competencies    skill tags
     * @param complexity      1-5
     * @param type            individual, pair or group
     * @param dependencies    ids of tasks that come first
     * @param durationMinutes estimated minutes
     * @param stage           preparation, execution or reflection
     */
    public record Item(
        String id,
        String description,
        List<String> competencies,
        Integer complexity,
        String type,
        List<String> dependencies,
        Integer durationMinutes,
        String stage
    ) {}
}
