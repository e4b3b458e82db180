package com.tessera.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Participant id to ordered list of assigned items.
 * <p>
 * Participant order follows the order the engine received them in. The map and
 * its lists are unmodifiable.
 */
public final class AssignmentRecord {

    private static final AssignmentRecord EMPTY = new AssignmentRecord(Map.of());

    private final Map<String, List<AssignmentEntry>> assignments;

    public AssignmentRecord(Map<String, List<AssignmentEntry>> assignments) {
        var copy = new LinkedHashMap<String, List<AssignmentEntry>>();
        assignments.forEach((participantId, entries) -> copy.put(participantId, List.copyOf(entries)));
        this.assignments = Collections.unmodifiableMap(copy);
    }

    public static AssignmentRecord empty() {
        return EMPTY;
    }

    public Map<String, List<AssignmentEntry>> assignments() {
        return assignments;
    }

    public List<AssignmentEntry> entriesFor(String participantId) {
        return assignments.getOrDefault(participantId, List.of());
    }

    public Optional<String> participantFor(String itemId) {
        for (var e : assignments.entrySet()) {
            for (var entry : e.getValue()) {
                if (entry.itemId().equals(itemId)) {
                    return Optional.of(e.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public int totalAssigned() {
        return assignments.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return totalAssigned() == 0;
    }

    public List<String> assignedItemIds() {
        var ids = new ArrayList<String>();
        assignments.values().forEach(entries -> entries.forEach(entry -> ids.add(entry.itemId())));
        return ids;
    }

    /**
     * Checks the record against the batch and population it was built from.
     *
     * @throws IllegalStateException naming the first broken invariant
     */
    public void verify(Collection<String> itemIds, Collection<String> participantIds) {
        Set<String> knownItems = new HashSet<>(itemIds);
        Set<String> knownParticipants = new HashSet<>(participantIds);
        Set<String> seen = new HashSet<>();
        for (var e : assignments.entrySet()) {
            if (!knownParticipants.contains(e.getKey())) {
                throw new IllegalStateException("Unknown participant in assignment: " + e.getKey());
            }
            for (var entry : e.getValue()) {
                if (!knownItems.contains(entry.itemId())) {
                    throw new IllegalStateException("Unknown item in assignment: " + entry.itemId());
                }
                if (!seen.add(entry.itemId())) {
                    throw new IllegalStateException("Item assigned twice: " + entry.itemId());
                }
            }
        }
        if (seen.size() != knownItems.size()) {
            throw new IllegalStateException("Assigned " + seen.size() + " of " + knownItems.size() + " items");
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AssignmentRecord other && assignments.equals(other.assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return "AssignmentRecord" + assignments;
    }
}
