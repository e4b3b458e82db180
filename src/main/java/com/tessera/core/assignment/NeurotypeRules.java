package com.tessera.core.assignment;

import com.tessera.core.model.Neurotype;
import com.tessera.core.model.ParticipantProfile;
import com.tessera.core.model.WorkItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Score adjustments keyed on neurotype and the item's tags or complexity.
 */
public final class NeurotypeRules {

    /**
     * One applied rule.
     *
     * @param label short description for the rationale
     * @param delta signed score change before weighting
     */
    public record Adjustment(String label, double delta) {
        public boolean isPenalty() {
            return delta < 0;
        }
    }

    private NeurotypeRules() {} // utility class

    public static List<Adjustment> adjustments(WorkItem item, ParticipantProfile participant) {
        var out = new ArrayList<Adjustment>();
        Neurotype neurotype = participant.neurotype();
        switch (neurotype) {
            case ASD -> {
                if (item.hasCompetency("improvisation")) {
                    out.add(new Adjustment("ASD improvisation", -0.3));
                }
                if (item.hasCompetency("structure")) {
                    out.add(new Adjustment("ASD structure", 0.2));
                }
                if (item.hasCompetency("precision")) {
                    out.add(new Adjustment("ASD precision", 0.2));
                }
            }
            case ADHD -> {
                if (item.hasCompetency("movement")) {
                    out.add(new Adjustment("ADHD movement", 0.2));
                }
                if (item.hasCompetency("dynamic")) {
                    out.add(new Adjustment("ADHD dynamic", 0.2));
                }
                if (item.complexity() > 3) {
                    out.add(new Adjustment("ADHD complexity " + item.complexity(), -0.2));
                }
            }
            case GIFTED -> {
                if (item.complexity() >= 4) {
                    out.add(new Adjustment("GIFTED complexity " + item.complexity(), 0.2));
                }
                if (item.hasCompetency("simple")) {
                    out.add(new Adjustment("GIFTED simple", -0.2));
                }
            }
            default -> { }
        }
        return out;
    }
}
