package com.tessera.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A participant's capability, preference and neurotype record. Immutable once loaded.
 *
 * @param id               repository-unique identifier
 * @param name             display name
 * @param strengths        competency tags the participant is good at
 * @param supportNeeds     support tags (e.g., "structured-routines", "visual-supports")
 * @param neurotype        categorical support classification
 * @param availability     0-100; drives the per-request load cap
 * @param roleHistory      roles taken in earlier activities, oldest first
 * @param preferredChannel preferred learning channel (visual, auditory, kinesthetic), may be null
 */
public record ParticipantProfile(
    String id,
    String name,
    Set<String> strengths,
    Set<String> supportNeeds,
    Neurotype neurotype,
    int availability,
    List<String> roleHistory,
    String preferredChannel
) {

    public ParticipantProfile {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
        if (availability < 0 || availability > 100) {
            throw new IllegalArgumentException("Participant " + id + " availability out of range: " + availability);
        }
        name = name != null ? name : id;
        neurotype = neurotype != null ? neurotype : Neurotype.TYPICAL;
        strengths = orderedCopy(strengths);
        supportNeeds = orderedCopy(supportNeeds);
        roleHistory = roleHistory != null ? List.copyOf(roleHistory) : List.of();
    }

    private static Set<String> orderedCopy(Set<String> source) {
        if (source == null || source.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
