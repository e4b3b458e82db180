package com.tessera.core.engine;

import com.tessera.core.model.AssignmentResult;
import com.tessera.core.model.ConsensusDecision;
import com.tessera.core.model.DecisionType;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.WorkItem;
import com.tessera.core.parser.ParseConfidence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one planning request produced.
 *
 * @param requestId        request id
 * @param items            normalized work items
 * @param participants     participants the items were assigned to
 * @param assignment       assignment of the items
 * @param parseConfidence  confidence of the parse strategy that won
 * @param parseStrategy    name of that strategy
 * @param consensus        consensus decision, null when consensus did not run
 * @param generationFailed true when the decomposition call to the text service failed
 */
public record PlanningResult(
    String requestId,
    List<WorkItem> items,
    List<ParticipantProfile> participants,
    AssignmentResult assignment,
    ParseConfidence parseConfidence,
    String parseStrategy,
    ConsensusDecision consensus,
    boolean generationFailed
) {
    public PlanningResult {
        items = List.copyOf(items);
        participants = List.copyOf(participants);
    }

    /**
     * True when any stage fell back to a weaker path.
     */
    public boolean degraded() {
        return generationFailed
                || parseConfidence == ParseConfidence.FALLBACK
                || assignment.degraded()
                || (consensus != null && consensus.type() == DecisionType.FALLBACK);
    }

    /**
     * Items grouped by stage, stages in first-seen order.
     */
    public Map<String, List<WorkItem>> phases() {
        var phases = new LinkedHashMap<String, List<WorkItem>>();
        for (WorkItem item : items) {
            phases.computeIfAbsent(item.stage(), k -> new ArrayList<>()).add(item);
        }
        phases.replaceAll((stage, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(phases);
    }
}
