package com.tessera.core.parser;

/**
 * How much structure the winning strategy found in the text. Ordered from most to
 * least trustworthy.
 */
public enum ParseConfidence {
    STRICT(1.0),
    TOLERANT(0.8),
    REPLAY(0.6),
    MINIMAL(0.4),
    FALLBACK(0.1);

    private final double score;

    ParseConfidence(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}
