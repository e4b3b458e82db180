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
 * Judges inclusiveness and lists the adaptations participants need. Its adjustments,
 * if any, are kept as adaptations.
 */
@Component
public class PedagogicalEvaluator extends AbstractLlmCollaborator {

    public static final String ID = "pedagogical-evaluator";

    public PedagogicalEvaluator(TextGenerationClient client, JsonResponseReader reader, PromptBuilder promptBuilder) {
        super(ID, ProposalRole.PEDAGOGICAL, client, reader, promptBuilder);
    }

    @Override
    protected ProposalDecision toDecision(CollaboratorReply reply) {
        Verdict verdict = verdictOf(reply, Verdict.REQUIRES_REVISION);
        var adaptations = new ArrayList<String>();
        if (reply.adaptations() != null) {
            adaptations.addAll(reply.adaptations());
        }
        if (reply.adjustments() != null) {
            adaptations.addAll(reply.adjustments());
        }
        return new ProposalDecision(ID, ProposalRole.PEDAGOGICAL, structureOf(reply), adaptations, List.of(),
                verdict, scoreOf(reply, verdict));
    }
}
