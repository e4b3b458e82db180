package com.tessera.core.consensus;

import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.Verdict;
import com.tessera.core.prompt.PromptBuilder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks time, materials and supervision. Anything it lists counts as a practical adjustment.
 */
@Component
public class FeasibilityEvaluator extends AbstractLlmCollaborator {

    public static final String ID = "feasibility-evaluator";

    public FeasibilityEvaluator(TextGenerationClient client, JsonResponseReader reader, PromptBuilder promptBuilder) {
        super(ID, ProposalRole.FEASIBILITY, client, reader, promptBuilder);
    }

    @Override
    protected ProposalDecision toDecision(CollaboratorReply reply) {
        Verdict verdict = verdictOf(reply, Verdict.REQUIRES_REVISION);
        var adjustments = new ArrayList<String>();
        if (reply.adjustments() != null) {
            adjustments.addAll(reply.adjustments());
        }
        if (reply.adaptations() != null) {
            adjustments.addAll(reply.adaptations());
        }
        return new ProposalDecision(ID, ProposalRole.FEASIBILITY, structureOf(reply), List.of(),
                adjustments, verdict, scoreOf(reply, verdict));
    }
}
