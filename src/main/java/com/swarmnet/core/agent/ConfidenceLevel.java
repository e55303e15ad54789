package com.swarmnet.core.agent;

/**
 * Ordinal confidence: HIGH &gt; MEDIUM &gt; LOW.
 *
 * fromScore() is the single score → level mapping used by both role results
 * and the ConfidenceValidator:
 *   score ≥ 0.8 → HIGH
 *   score ≥ 0.6 → MEDIUM
 *   otherwise   → LOW
 */
public enum ConfidenceLevel {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    public static final double HIGH_THRESHOLD   = 0.8;
    public static final double MEDIUM_THRESHOLD = 0.6;

    // Weighted sums like 0.3 + 0.3 + 0.2 land a hair below 0.8 in binary floating point.
    private static final double EPSILON = 1e-9;

    private final int rank;

    ConfidenceLevel(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAtLeast(ConfidenceLevel other) {
        return rank >= other.rank;
    }

    public static ConfidenceLevel fromScore(double score) {
        if (score + EPSILON >= HIGH_THRESHOLD)   return HIGH;
        if (score + EPSILON >= MEDIUM_THRESHOLD) return MEDIUM;
        return LOW;
    }
}
