package com.tessera.core.consensus;

import com.tessera.core.llm.JsonResponseReader;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.Verdict;
import com.tessera.core.prompt.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Shared plumbing for collaborators backed by the text service: build the role prompt,
 * call the client with the request's timeout, read a {@link CollaboratorReply}.
 * Subclasses decide how a reply becomes a {@link ProposalDecision}.
 */
public abstract class AbstractLlmCollaborator implements ProposalCollaborator {

    private static final Logger log = LoggerFactory.getLogger(AbstractLlmCollaborator.class);

    private final String id;
    private final ProposalRole role;
    private final TextGenerationClient client;
    private final JsonResponseReader reader;
    private final PromptBuilder promptBuilder;

    protected AbstractLlmCollaborator(String id, ProposalRole role, TextGenerationClient client,
                                      JsonResponseReader reader, PromptBuilder promptBuilder) {
        this.id = id;
        this.role = role;
        this.client = client;
        this.reader = reader;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ProposalRole role() {
        return role;
    }

    @Override
    public ProposalDecision propose(ConsensusRequest request) {
        String prompt = promptBuilder.collaboratorPrompt(role, request);
        String reply = client.generate(prompt, request.maxTokens(), request.timeout());
        log.debug("[{}] reply: {}", id, reply);
        CollaboratorReply parsed = reader.read(id, reply, CollaboratorReply.class)
                .orElseThrow(() -> new ProposalParseException(id, reply));
        ProposalDecision decision = toDecision(parsed);
        log.info("[{}] verdict {} (score {})", id, decision.verdict(), decision.score());
        return decision;
    }

    protected abstract ProposalDecision toDecision(CollaboratorReply reply);

    /**
     * Verdict as written, or {@code whenMissing} when the reply has none.
     */
    protected static Verdict verdictOf(CollaboratorReply reply, Verdict whenMissing) {
        return reply.verdict() == null || reply.verdict().isBlank() ? whenMissing : Verdict.fromLabel(reply.verdict());
    }

    /**
     * Score as written, otherwise a default that matches the verdict.
     */
    protected static double scoreOf(CollaboratorReply reply, Verdict verdict) {
        if (reply.score() != null) {
            return reply.score();
        }
        return switch (verdict) {
            case APPROVED -> 0.8;
            case APPROVED_WITH_ADAPTATIONS -> 0.65;
            case REQUIRES_REVISION -> 0.4;
        };
    }

    /**
     * Structure described by the reply, with canonical values for the missing parts;
     * null when the reply describes no structure at all.
     */
    protected static ProposalStructure structureOf(CollaboratorReply reply) {
        if (!reply.describesStructure()) {
            return null;
        }
        ProposalStructure canonical = ProposalStructure.CANONICAL;
        String type = reply.activityType() != null && !reply.activityType().isBlank()
                ? reply.activityType().trim() : canonical.activityType();
        List<String> stages = reply.stages() != null && !reply.stages().isEmpty() ? reply.stages() : canonical.stages();
        CollaborationMode mode = CollaborationMode.fromLabel(reply.collaborationMode()).orElse(null);
        int count = reply.suggestedItemCount() != null ? reply.suggestedItemCount() : 0;
        String summary = reply.summary() != null ? reply.summary().trim() : "";
        return new ProposalStructure(type, stages, mode, count, summary);
    }
}
