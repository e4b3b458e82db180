package com.tessera.core.engine;

import com.tessera.core.assignment.AssignmentEngine;
import com.tessera.core.assignment.NoParticipantsException;
import com.tessera.core.config.TesseraProperties;
import com.tessera.core.consensus.ConsensusCoordinator;
import com.tessera.core.consensus.ConsensusRequest;
import com.tessera.core.llm.GenerationFailureException;
import com.tessera.core.llm.TextGenerationClient;
import com.tessera.core.logging.MdcContext;
import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.model.AssignmentResult;
import com.tessera.core.model.ConsensusDecision;
import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.parser.ParseHints;
import com.tessera.core.parser.ParseResult;
import com.tessera.core.parser.ResponseParser;
import com.tessera.core.participant.ParticipantRepository;
import com.tessera.core.prompt.PromptBuilder;
import com.tessera.core.retrieval.ExampleRetriever;
import com.tessera.core.retrieval.RankedExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one planning request end to end: optional consensus, decomposition by the text
 * service, parsing, normalization and assignment.
 * <p>
 * Every stage that can fail falls back rather than aborting; the only error that escapes
 * is {@link NoParticipantsException}, since a plan nobody can carry out is not a plan.
 */
@Service
public class PlanningEngine {

    private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);

    private final AtomicInteger requestCounter = new AtomicInteger(0);

    private final TextGenerationClient client;
    private final ResponseParser parser;
    private final AssignmentEngine assignmentEngine;
    private final ConsensusCoordinator consensusCoordinator;
    private final ExampleRetriever exampleRetriever;
    private final PromptBuilder promptBuilder;
    private final ParticipantRepository repository;
    private final TesseraProperties properties;
    private final TesseraMetrics metrics;

    public PlanningEngine(TextGenerationClient client,
                          ResponseParser parser,
                          AssignmentEngine assignmentEngine,
                          ConsensusCoordinator consensusCoordinator,
                          ExampleRetriever exampleRetriever,
                          PromptBuilder promptBuilder,
                          ParticipantRepository repository,
                          TesseraProperties properties,
                          TesseraMetrics metrics) {
        this.client = client;
        this.parser = parser;
        this.assignmentEngine = assignmentEngine;
        this.consensusCoordinator = consensusCoordinator;
        this.exampleRetriever = exampleRetriever;
        this.promptBuilder = promptBuilder;
        this.repository = repository;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * @throws NoParticipantsException  when neither the request nor the repository has participants
     * @throws IllegalArgumentException when request participants are invalid
     */
    public PlanningResult plan(PlanningRequest request) {
        long start = System.currentTimeMillis();
        Duration timeout = request.timeout() != null ? request.timeout() : properties.getGeneration().getTimeout();
        var context = new RequestContext(generateRequestId(), request.intent().strip(), request.weights(),
                timeout, properties.getGeneration().getMaxTokens(), Instant.now());

        try (var scope = MdcContext.scope(context)) {
            log.info("Starting planning request {} (consensus={}, timeout={}s)", context.requestId(),
                    request.consensus(), timeout.toSeconds());

            List<ParticipantProfile> participants = request.participants() != null
                    ? ParticipantRepository.of(request.participants()).findAll()
                    : repository.findAll();
            if (participants.isEmpty()) {
                throw new NoParticipantsException("No participants available for request " + context.requestId());
            }

            ConsensusDecision consensus = null;
            ProposalStructure structure = null;
            if (request.consensus() && properties.getConsensus().isEnabled()) {
                MdcContext.setStage("consensus");
                consensus = consensusCoordinator.decide(new ConsensusRequest(context.intent(),
                        summarize(participants), context.weights(), context.timeout(), context.maxTokens()));
                structure = consensus.structure();
            }

            MdcContext.setStage("decomposition");
            List<RankedExample> examples = retrieveExamples(context.intent());
            String prompt = promptBuilder.decompositionPrompt(context.intent(), examples, structure,
                    properties.getParser().getMaxItems());
            boolean generationFailed = false;
            String raw;
            try {
                raw = client.generate(prompt, context.maxTokens(), context.timeout());
            } catch (GenerationFailureException e) {
                log.warn("Decomposition call failed ({}): {}; parsing without generated text", e.kind(), e.getMessage());
                metrics.recordGenerationFailure(e.kind().name());
                generationFailed = true;
                raw = "";
            }
            log.debug("Decomposition reply: {}", raw);

            MdcContext.setStage("parse");
            ParseHints hints = new ParseHints(context.intent(), properties.getParser().isReplayEnabled(),
                    context.timeout(), context.maxTokens(), structure);
            ParseResult parsed = parser.parse(raw, hints);

            MdcContext.setStage("assignment");
            AssignmentResult assignment = assignmentEngine.assign(parsed.items(), participants, context.weights());

            var result = new PlanningResult(context.requestId(), parsed.items(), participants, assignment,
                    parsed.confidence(),
                    parsed.strategyName(), consensus, generationFailed);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordPlanningDuration(elapsed);
            metrics.recordItemCount(result.items().size());
            log.info("Planning request {} finished in {}ms: {} items, parse {}, assignment {}{}",
                    context.requestId(), elapsed, result.items().size(), parsed.confidence(),
                    assignment.path(), result.degraded() ? " (degraded)" : "");
            return result;
        }
    }

    /**
     * Generates a request id in the format PLAN-YYYY-NNNN.
     */
    public String generateRequestId() {
        int count = requestCounter.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("PLAN-%d-%04d", year, count);
    }

    private List<RankedExample> retrieveExamples(String intent) {
        try {
            return exampleRetriever.findSimilar(intent, properties.getExamples().getTopK());
        } catch (RuntimeException e) {
            log.warn("Example retrieval failed, continuing without examples: {}", e.getMessage());
            return List.of();
        }
    }

    static String summarize(List<ParticipantProfile> participants) {
        Map<Neurotype, Integer> counts = new EnumMap<>(Neurotype.class);
        var needs = new LinkedHashSet<String>();
        for (ParticipantProfile p : participants) {
            counts.merge(p.neurotype(), 1, Integer::sum);
            needs.addAll(p.supportNeeds());
        }
        var sb = new StringBuilder();
        sb.append(participants.size()).append(" participants");
        var parts = new StringBuilder();
        counts.forEach((neurotype, count) -> {
            if (parts.length() > 0) {
                parts.append(", ");
            }
            parts.append(count).append(' ').append(neurotype.name().toLowerCase(Locale.ROOT));
        });
        sb.append(" (").append(parts).append(')');
        if (!needs.isEmpty()) {
            sb.append("; support needs: ").append(String.join(", ", needs));
        }
        return sb.toString();
    }
}
