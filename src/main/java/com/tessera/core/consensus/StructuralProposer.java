package com.tessera.core.consensus;

import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.Verdict;
import com.tessera.core.prompt.PromptBuilder;
import org.springframework.stereotype.Component;

/**
 * Proposes the activity's shape: type, stages, dominant mode, item count.
 */
@Component
public class StructuralProposer extends AbstractLlmCollaborator {

    public static final String ID = "structural-proposer";

    public StructuralProposer(TextGenerationClient client, JsonResponseReader reader, PromptBuilder promptBuilder) {
        super(ID, ProposalRole.STRUCTURAL, client, reader, promptBuilder);
    }

    @Override
    protected ProposalDecision toDecision(CollaboratorReply reply) {
        ProposalStructure structure = structureOf(reply);
        Verdict verdict = verdictOf(reply, Verdict.APPROVED);
        return new ProposalDecision(ID, ProposalRole.STRUCTURAL,
                structure != null ? structure : ProposalStructure.CANONICAL,
                reply.adaptations(), reply.adjustments(), verdict, scoreOf(reply, verdict));
    }
}
