package com.tessera.core.assignment;

import com.tessera.core.config.TesseraProperties;
import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.model.AssignmentEntry;
import com.tessera.core.model.AssignmentPath;
import com.tessera.core.model.AssignmentRecord;
import com.tessera.core.model.AssignmentResult;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns work items to participants.
 * <p>
 * When an optimizer is available its proposal is tried first and used only if, after id
 * reconciliation, it places every item exactly once. Otherwise a capacity-bounded greedy
 * pass runs: hardest items first, each to the best-scoring participant still under their
 * cap, followed by a back-fill so nobody is left empty while someone else holds several
 * items. All load bookkeeping is local to the call.
 */
@Service
public class AssignmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AssignmentEngine.class);

    private static final double SCORE_EPSILON = 1e-9;

    private final CompatibilityScorer scorer;
    private final AssignmentOptimizer optimizer;
    private final boolean optimizerEnabled;
    private final TesseraMetrics metrics;

    @Autowired
    public AssignmentEngine(CompatibilityScorer scorer, Optional<AssignmentOptimizer> optimizer,
                            TesseraProperties properties, TesseraMetrics metrics) {
        this(scorer, optimizer.orElse(null), properties.getAssignment().isOptimizerEnabled(), metrics);
    }

    public AssignmentEngine(CompatibilityScorer scorer, AssignmentOptimizer optimizer,
                            boolean optimizerEnabled, TesseraMetrics metrics) {
        this.scorer = scorer;
        this.optimizer = optimizer;
        this.optimizerEnabled = optimizerEnabled;
        this.metrics = metrics;
    }

    public AssignmentResult assign(List<WorkItem> items, List<ParticipantProfile> participants,
                                   PreferenceWeights weights) {
        if (items == null || items.isEmpty()) {
            log.info("No work items to assign");
            metrics.recordAssignmentPath(AssignmentPath.EMPTY.name(), false);
            return AssignmentResult.empty();
        }
        if (participants == null || participants.isEmpty()) {
            throw new NoParticipantsException(items.size());
        }
        PreferenceWeights w = weights != null ? weights : PreferenceWeights.NEUTRAL;
        var notes = new ArrayList<String>();
        boolean degraded = false;

        if (optimizer != null && optimizerEnabled) {
            try {
                AssignmentRecord record = fromOptimizer(items, participants, w, notes);
                record.verify(ids(items), participantIds(participants));
                log.info("Assignment via optimizer: {} items over {} participants", items.size(), participants.size());
                metrics.recordAssignmentPath(AssignmentPath.OPTIMIZER.name(), false);
                return new AssignmentResult(record, AssignmentPath.OPTIMIZER, false, notes);
            } catch (AssignmentValidationException e) {
                log.warn("Optimizer proposal rejected: {}", e.getMessage());
                notes.add("optimizer rejected: " + e.getMessage());
                degraded = true;
            } catch (RuntimeException e) {
                log.warn("Optimizer failed ({}): {}", e.getClass().getSimpleName(), e.getMessage());
                notes.add("optimizer failed: " + e.getClass().getSimpleName());
                degraded = true;
            }
        }

        AssignmentRecord record = greedy(items, participants, w, notes);
        record.verify(ids(items), participantIds(participants));
        log.info("Assignment via greedy pass: {} items over {} participants{}", items.size(),
                participants.size(), degraded ? " (optimizer fallback)" : "");
        metrics.recordAssignmentPath(AssignmentPath.GREEDY.name(), degraded);
        return new AssignmentResult(record, AssignmentPath.GREEDY, degraded, notes);
    }

    // --- optimizer path ---

    private AssignmentRecord fromOptimizer(List<WorkItem> items, List<ParticipantProfile> participants,
                                           PreferenceWeights weights, List<String> notes) {
        Map<String, List<String>> proposal = optimizer.propose(items, participants, weights);
        if (proposal == null || proposal.isEmpty() || proposal.values().stream().allMatch(List::isEmpty)) {
            throw new AssignmentValidationException("empty proposal");
        }

        Map<String, ParticipantProfile> known = new LinkedHashMap<>();
        participants.forEach(p -> known.put(p.id(), p));
        Map<String, List<String>> byParticipant = new HashMap<>();
        int droppedParticipants = 0;
        for (var e : proposal.entrySet()) {
            Optional<String> pid = matchParticipant(e.getKey(), known.keySet());
            if (pid.isEmpty()) {
                log.warn("Dropping unknown participant '{}' from optimizer proposal", e.getKey());
                notes.add("dropped unknown participant " + e.getKey());
                droppedParticipants++;
                continue;
            }
            byParticipant.computeIfAbsent(pid.get(), k -> new ArrayList<>()).addAll(e.getValue());
        }
        metrics.recordDroppedIds("participant", droppedParticipants);

        Set<String> canonical = new HashSet<>(ids(items));
        var returned = new ArrayList<String>();
        byParticipant.values().forEach(returned::addAll);
        Map<String, String> mapping = new HashMap<>();
        if (returned.stream().allMatch(canonical::contains)) {
            returned.forEach(id -> mapping.put(id, id));
        } else {
            Optional<Map<String, String>> remap = OrdinalIdRemapper.remap(returned, ids(items));
            if (remap.isEmpty()) {
                long unknown = returned.stream().filter(id -> !canonical.contains(id)).distinct().count();
                metrics.recordDroppedIds("item", (int) unknown);
                throw new AssignmentValidationException("unknown item ids and " + new HashSet<>(returned).size()
                        + " distinct ids for " + items.size() + " items");
            }
            Map<String, String> remapped = remap.get();
            mapping.putAll(remapped);
            log.warn("Remapped optimizer item ids by ordinal position: {}", remapped);
            notes.add("remapped item ids by ordinal position");
        }

        Map<String, WorkItem> itemsById = new HashMap<>();
        items.forEach(item -> itemsById.put(item.id(), item));
        Set<String> placed = new HashSet<>();
        var assignments = new LinkedHashMap<String, List<AssignmentEntry>>();
        for (ParticipantProfile p : participants) {
            var entries = new ArrayList<AssignmentEntry>();
            for (String raw : byParticipant.getOrDefault(p.id(), List.of())) {
                String itemId = mapping.get(raw);
                if (!placed.add(itemId)) {
                    throw new AssignmentValidationException("item " + itemId + " assigned more than once");
                }
                var score = scorer.score(itemsById.get(itemId), p, weights);
                entries.add(new AssignmentEntry(itemId, score.value(), score.rationale()));
            }
            assignments.put(p.id(), entries);
        }
        if (placed.size() != items.size()) {
            throw new AssignmentValidationException("placed " + placed.size() + " of " + items.size() + " items");
        }
        return new AssignmentRecord(assignments);
    }

    /**
     * Exact id, or the id with a leading alphabetic prefix such as {@code participant_} removed.
     */
    static Optional<String> matchParticipant(String returnedId, Set<String> knownIds) {
        if (returnedId == null) {
            return Optional.empty();
        }
        String trimmed = returnedId.trim();
        if (knownIds.contains(trimmed)) {
            return Optional.of(trimmed);
        }
        String stripped = trimmed.replaceFirst("^[A-Za-z]+[_\\-\\s]*", "");
        if (!stripped.isEmpty() && knownIds.contains(stripped)) {
            return Optional.of(stripped);
        }
        return Optional.empty();
    }

    // --- greedy path ---

    private AssignmentRecord greedy(List<WorkItem> items, List<ParticipantProfile> participants,
                                    PreferenceWeights weights, List<String> notes) {
        Map<String, Integer> loads = new HashMap<>();
        Map<String, Integer> caps = new HashMap<>();
        Map<String, List<AssignmentEntry>> entries = new LinkedHashMap<>();
        for (ParticipantProfile p : participants) {
            loads.put(p.id(), 0);
            caps.put(p.id(), LoadCapPolicy.capFor(p));
            entries.put(p.id(), new ArrayList<>());
        }

        Set<String> batchIds = new HashSet<>(ids(items));
        Set<String> assigned = new HashSet<>();
        List<Integer> remaining = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            remaining.add(i);
        }

        while (!remaining.isEmpty()) {
            int next = remaining.stream()
                    .min(Comparator.<Integer>comparingInt(i -> -items.get(i).complexity())
                            .thenComparingInt(i -> dependenciesSatisfied(items.get(i), assigned, batchIds) ? 0 : 1)
                            .thenComparingInt(i -> i))
                    .orElseThrow();
            remaining.remove(Integer.valueOf(next));
            WorkItem item = items.get(next);

            List<ParticipantProfile> open = participants.stream()
                    .filter(p -> loads.get(p.id()) < caps.get(p.id()))
                    .toList();
            List<ParticipantProfile> candidates = open;
            if (open.isEmpty()) {
                int leastOverflow = participants.stream()
                        .mapToInt(p -> loads.get(p.id()) - caps.get(p.id()))
                        .min().orElse(0);
                candidates = participants.stream()
                        .filter(p -> loads.get(p.id()) - caps.get(p.id()) == leastOverflow)
                        .toList();
            }

            ParticipantProfile best = null;
            CompatibilityScorer.Score bestScore = null;
            for (ParticipantProfile p : candidates) {
                var score = scorer.score(item, p, weights);
                if (best == null || better(score, p, bestScore, best, loads)) {
                    best = p;
                    bestScore = score;
                }
            }
            if (open.isEmpty()) {
                log.warn("All participants at capacity, {} goes to {} over cap", item.id(), best.id());
                notes.add(item.id() + " assigned over capacity to " + best.id());
            }
            log.debug("{} -> {} (score {})", item.id(), best.id(), bestScore.value());
            entries.get(best.id()).add(new AssignmentEntry(item.id(), bestScore.value(), bestScore.rationale()));
            loads.merge(best.id(), 1, Integer::sum);
            assigned.add(item.id());
        }

        backFill(items, participants, weights, entries, notes);
        return new AssignmentRecord(entries);
    }

    private boolean better(CompatibilityScorer.Score score, ParticipantProfile p,
                           CompatibilityScorer.Score bestScore, ParticipantProfile best, Map<String, Integer> loads) {
        if (score.value() > bestScore.value() + SCORE_EPSILON) {
            return true;
        }
        if (score.value() < bestScore.value() - SCORE_EPSILON) {
            return false;
        }
        int loadCmp = Integer.compare(loads.get(p.id()), loads.get(best.id()));
        if (loadCmp != 0) {
            return loadCmp < 0;
        }
        return OrdinalIdRemapper.NATURAL.compare(p.id(), best.id()) < 0;
    }

    private void backFill(List<WorkItem> items, List<ParticipantProfile> participants, PreferenceWeights weights,
                          Map<String, List<AssignmentEntry>> entries, List<String> notes) {
        Map<String, WorkItem> itemsById = new HashMap<>();
        items.forEach(item -> itemsById.put(item.id(), item));
        while (true) {
            Optional<ParticipantProfile> recipient = participants.stream()
                    .filter(p -> entries.get(p.id()).isEmpty())
                    .findFirst();
            Optional<ParticipantProfile> donor = participants.stream()
                    .filter(p -> entries.get(p.id()).size() > 1)
                    .max(Comparator.<ParticipantProfile>comparingInt(p -> entries.get(p.id()).size())
                            .thenComparing(ParticipantProfile::id, OrdinalIdRemapper.NATURAL.reversed()));
            if (recipient.isEmpty() || donor.isEmpty()) {
                return;
            }
            ParticipantProfile to = recipient.get();
            List<AssignmentEntry> donorEntries = entries.get(donor.get().id());
            int bestIndex = -1;
            CompatibilityScorer.Score bestScore = null;
            for (int i = 0; i < donorEntries.size(); i++) {
                var score = scorer.score(itemsById.get(donorEntries.get(i).itemId()), to, weights);
                if (bestScore == null || score.value() > bestScore.value() + SCORE_EPSILON) {
                    bestIndex = i;
                    bestScore = score;
                }
            }
            AssignmentEntry moved = donorEntries.remove(bestIndex);
            entries.get(to.id()).add(new AssignmentEntry(moved.itemId(), bestScore.value(), bestScore.rationale()));
            log.debug("Back-fill: {} moved from {} to {}", moved.itemId(), donor.get().id(), to.id());
            notes.add("back-filled " + moved.itemId() + " from " + donor.get().id() + " to " + to.id());
        }
    }

    private static boolean dependenciesSatisfied(WorkItem item, Set<String> assigned, Set<String> batchIds) {
        for (String dep : item.dependencies()) {
            if (batchIds.contains(dep) && !assigned.contains(dep)) {
                return false;
            }
        }
        return true;
    }

    private static List<String> ids(List<WorkItem> items) {
        return items.stream().map(WorkItem::id).toList();
    }

    private static List<String> participantIds(List<ParticipantProfile> participants) {
        return participants.stream().map(ParticipantProfile::id).toList();
    }
}
