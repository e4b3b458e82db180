package com.tessera.core.model;

/**
 * Optional planner preference weights, each in [0,1].
 */
public record PreferenceWeights(double structure, double collaboration, double flexibility) {

    public static final PreferenceWeights NEUTRAL = new PreferenceWeights(0.0, 0.0, 0.0);

    public PreferenceWeights {
        check("structure", structure);
        check("collaboration", collaboration);
        check("flexibility", flexibility);
    }

    private static void check(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " weight must be within [0,1], got " + value);
        }
    }
}
