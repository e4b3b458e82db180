package com.tessera.core.consensus;

import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalRole;

/**
 * One independent opinion in the consensus round.
 */
public interface ProposalCollaborator {

    String id();

    ProposalRole role();

    /**
     * @throws RuntimeException on any failure; the coordinator turns it into a fallback
     */
    ProposalDecision propose(ConsensusRequest request);
}
