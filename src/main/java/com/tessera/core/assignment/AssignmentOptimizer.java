package com.tessera.core.assignment;

import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * External proposer of a complete assignment. Its output is untrusted: the engine
 * validates ids and coverage before using it.
 */
public interface AssignmentOptimizer {

    /**
     * @return participant id to item ids, in whatever id scheme the optimizer used;
     *         empty when it has no proposal
     */
    Map<String, List<String>> propose(List<WorkItem> items, List<ParticipantProfile> participants,
                                      PreferenceWeights weights);
}
