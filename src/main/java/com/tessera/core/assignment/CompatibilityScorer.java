package com.tessera.core.assignment;

import com.tessera.core.model.CollaborationMode;
import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.PreferenceWeights;
import com.tessera.core.model.WorkItem;
import com.tessera.core.participant.ParticipantProfileFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores how well a participant fits an item: a 0.5 base, 0.1 per matched strength,
 * neurotype adjustments and preference weights, clamped to [0, 1].
 */
@Component
public class CompatibilityScorer {

    static final double BASE = 0.5;
    static final double PER_STRENGTH = 0.1;
    static final double WEIGHT_FACTOR = 0.1;

    /**
     * A score with the parts that produced it.
     *
     * @param value            final score in [0, 1], rounded to six decimals
     * @param matchedStrengths item competencies the participant is strong in
     * @param effects          applied neurotype and weight effects
     */
    public record Score(double value, List<String> matchedStrengths, List<String> effects) {

        public String rationale() {
            var sb = new StringBuilder();
            sb.append(matchedStrengths.isEmpty() ? "no matched strengths"
                    : "matched " + String.join(", ", matchedStrengths));
            if (!effects.isEmpty()) {
                sb.append("; ").append(String.join("; ", effects));
            }
            return sb.toString();
        }
    }

    public Score score(WorkItem item, ParticipantProfile participant, PreferenceWeights weights) {
        PreferenceWeights w = weights != null ? weights : PreferenceWeights.NEUTRAL;
        double value = BASE;

        var matched = new ArrayList<String>();
        for (String tag : item.requiredCompetencies()) {
            if (participant.strengths().contains(tag)) {
                matched.add(tag);
                value += PER_STRENGTH;
            }
        }

        var effects = new ArrayList<String>();
        double penaltyScale = 1.0 - 0.5 * w.flexibility();
        for (var adjustment : NeurotypeRules.adjustments(item, participant)) {
            double delta = adjustment.isPenalty() ? adjustment.delta() * penaltyScale : adjustment.delta();
            value += delta;
            effects.add(adjustment.label() + " " + signed(delta));
        }

        if ((item.hasCompetency("structure") || item.hasCompetency("precision")) && needsStructure(participant)
                && w.structure() > 0) {
            double bonus = w.structure() * WEIGHT_FACTOR;
            value += bonus;
            effects.add("structure preference " + signed(bonus));
        }
        if (item.collaborationMode() != CollaborationMode.INDIVIDUAL
                && participant.strengths().contains("collaboration") && w.collaboration() > 0) {
            double bonus = w.collaboration() * WEIGHT_FACTOR;
            value += bonus;
            effects.add("collaboration preference " + signed(bonus));
        }

        double clamped = Math.max(0.0, Math.min(1.0, value));
        return new Score(Math.round(clamped * 1e6) / 1e6, List.copyOf(matched), List.copyOf(effects));
    }

    private static boolean needsStructure(ParticipantProfile participant) {
        return participant.neurotype() == Neurotype.ASD
                || participant.supportNeeds().contains(ParticipantProfileFactory.STRUCTURED_ROUTINES);
    }

    private static String signed(double delta) {
        return String.format(Locale.ROOT, "%+.2f", delta);
    }
}
