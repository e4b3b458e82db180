package com.tessera.core.consensus;

import com.tessera.core.llm.GenerationFailureException;
import com.tessera.core.metrics.TesseraMetrics;
import com.tessera.core.model.ConsensusDecision;
import com.tessera.core.model.ConsensusState;
import com.tessera.core.model.DecisionType;
import com.tessera.core.model.ProposalDecision;
import com.tessera.core.model.ProposalRole;
import com.tessera.core.model.ProposalStructure;
import com.tessera.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Collects three independent opinions (structure, pedagogy, feasibility) and merges them.
 * <p>
 * State machine: {@code COLLECTING -> EVALUATING -> DECIDED} when every collaborator
 * answered, {@code COLLECTING -> FALLBACK} as soon as one of them failed. A collaborator
 * failure never escapes {@link #decide}. After a generation timeout the remaining
 * collaborators are skipped, since they share the same model.
 */
@Service
public class ConsensusCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusCoordinator.class);

    static final double STRUCTURAL_WEIGHT = 0.40;
    static final double PEDAGOGICAL_WEIGHT = 0.35;
    static final double FEASIBILITY_WEIGHT = 0.25;
    static final double PEDAGOGICAL_VETO_THRESHOLD = 0.6;
    static final double REVISION_THRESHOLD = 0.5;
    static final double CANONICAL_SCORE = 0.5;

    private static final List<ProposalRole> ORDER =
            List.of(ProposalRole.STRUCTURAL, ProposalRole.PEDAGOGICAL, ProposalRole.FEASIBILITY);

    private final Map<ProposalRole, ProposalCollaborator> collaborators = new EnumMap<>(ProposalRole.class);
    private final TesseraMetrics metrics;

    public ConsensusCoordinator(List<ProposalCollaborator> collaborators, TesseraMetrics metrics) {
        for (ProposalCollaborator collaborator : collaborators) {
            if (this.collaborators.putIfAbsent(collaborator.role(), collaborator) != null) {
                throw new IllegalArgumentException("Two collaborators for role " + collaborator.role());
            }
        }
        this.metrics = metrics;
    }

    public ConsensusDecision decide(ConsensusRequest request) {
        var trail = new ArrayList<ConsensusState>();
        trail.add(ConsensusState.COLLECTING);

        Map<ProposalRole, ProposalDecision> opinions = new EnumMap<>(ProposalRole.class);
        var failures = new ArrayList<String>();
        boolean timedOut = false;
        for (ProposalRole role : ORDER) {
            ProposalCollaborator collaborator = collaborators.get(role);
            if (collaborator == null) {
                failures.add(role.name().toLowerCase(Locale.ROOT) + ": no collaborator");
                continue;
            }
            if (timedOut) {
                failures.add(collaborator.id() + ": skipped after timeout");
                continue;
            }
            try {
                opinions.put(role, collaborator.propose(request));
            } catch (RuntimeException e) {
                log.warn("Collaborator {} failed ({}): {}", collaborator.id(), e.getClass().getSimpleName(),
                        e.getMessage());
                failures.add(collaborator.id() + ": " + e.getClass().getSimpleName());
                timedOut = isTimeout(e);
            }
        }

        ConsensusDecision decision = failures.isEmpty()
                ? evaluate(opinions, trail)
                : fallback(opinions, failures, trail);
        log.info("Consensus {} (verdict {}, score {})", decision.type(), decision.verdict(),
                String.format(Locale.ROOT, "%.2f", decision.weightedScore()));
        metrics.recordConsensusDecision(decision.type().name());
        return decision;
    }

    private ConsensusDecision evaluate(Map<ProposalRole, ProposalDecision> opinions, List<ConsensusState> trail) {
        trail.add(ConsensusState.EVALUATING);
        ProposalDecision structural = opinions.get(ProposalRole.STRUCTURAL);
        ProposalDecision pedagogical = opinions.get(ProposalRole.PEDAGOGICAL);
        ProposalDecision feasibility = opinions.get(ProposalRole.FEASIBILITY);
        double weighted = STRUCTURAL_WEIGHT * structural.score()
                + PEDAGOGICAL_WEIGHT * pedagogical.score()
                + FEASIBILITY_WEIGHT * feasibility.score();
        trail.add(ConsensusState.DECIDED);

        if (pedagogical.verdict() == Verdict.REQUIRES_REVISION && pedagogical.score() < PEDAGOGICAL_VETO_THRESHOLD) {
            log.warn("Pedagogical evaluator requires revision (score {}), adopting its modifications",
                    pedagogical.score());
            ProposalStructure structure = pedagogical.structure() != null
                    ? pedagogical.structure() : structureOrCanonical(structural);
            return new ConsensusDecision(DecisionType.MODIFICATION_PEDAGOGICAL, ConsensusState.DECIDED, structure,
                    merge(pedagogical.adaptationRequirements(), structural.adaptationRequirements(),
                            feasibility.adaptationRequirements()),
                    merge(pedagogical.feasibilityAdjustments(), structural.feasibilityAdjustments(),
                            feasibility.feasibilityAdjustments()),
                    Verdict.APPROVED_WITH_ADAPTATIONS, weighted,
                    List.of(pedagogical.proposerId(), structural.proposerId(), feasibility.proposerId()),
                    List.of(), trail, false);
        }

        List<String> adaptations = merge(structural.adaptationRequirements(), pedagogical.adaptationRequirements(),
                feasibility.adaptationRequirements());
        List<String> adjustments = merge(structural.feasibilityAdjustments(), pedagogical.feasibilityAdjustments(),
                feasibility.feasibilityAdjustments());
        Verdict verdict;
        if (weighted < REVISION_THRESHOLD) {
            verdict = Verdict.REQUIRES_REVISION;
        } else if (!adaptations.isEmpty() || !adjustments.isEmpty()
                || opinions.values().stream().anyMatch(o -> o.verdict() == Verdict.APPROVED_WITH_ADAPTATIONS)) {
            verdict = Verdict.APPROVED_WITH_ADAPTATIONS;
        } else {
            verdict = Verdict.APPROVED;
        }
        return new ConsensusDecision(DecisionType.CONSENSUS, ConsensusState.DECIDED, structureOrCanonical(structural),
                adaptations, adjustments, verdict, weighted,
                List.of(structural.proposerId(), pedagogical.proposerId(), feasibility.proposerId()),
                List.of(), trail, false);
    }

    private ConsensusDecision fallback(Map<ProposalRole, ProposalDecision> opinions, List<String> failures,
                                       List<ConsensusState> trail) {
        trail.add(ConsensusState.FALLBACK);
        ProposalDecision chosen = opinions.get(ProposalRole.STRUCTURAL);
        if (chosen == null) {
            chosen = ORDER.stream().map(opinions::get).filter(o -> o != null).findFirst().orElse(null);
        }
        if (chosen == null) {
            log.warn("No collaborator produced an opinion, using the canonical structure");
            return new ConsensusDecision(DecisionType.FALLBACK, ConsensusState.FALLBACK, ProposalStructure.CANONICAL,
                    List.of(), List.of(), Verdict.APPROVED_WITH_ADAPTATIONS, CANONICAL_SCORE,
                    List.of(), failures, trail, true);
        }
        log.warn("Consensus fell back to {} after {} failure(s)", chosen.proposerId(), failures.size());
        return new ConsensusDecision(DecisionType.FALLBACK, ConsensusState.FALLBACK, structureOrCanonical(chosen),
                chosen.adaptationRequirements(), chosen.feasibilityAdjustments(), chosen.verdict(), chosen.score(),
                List.of(chosen.proposerId()), failures, trail, true);
    }

    private static boolean isTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof GenerationFailureException g && g.kind() == GenerationFailureException.Kind.TIMEOUT) {
                return true;
            }
        }
        return false;
    }

    private static ProposalStructure structureOrCanonical(ProposalDecision decision) {
        return decision.structure() != null ? decision.structure() : ProposalStructure.CANONICAL;
    }

    @SafeVarargs
    private static List<String> merge(List<String>... lists) {
        Set<String> merged = new LinkedHashSet<>();
        for (List<String> list : lists) {
            for (String value : list) {
                if (value != null && !value.isBlank()) {
                    merged.add(value.trim());
                }
            }
        }
        return new ArrayList<>(merged);
    }
}
