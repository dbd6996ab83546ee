package com.arbiter.verdict;

/**
 * Weights of the three confidence signals. Must be non-negative and sum to 1.
 */
public record ConfidenceWeights(double rule, double precedent, double evidence) {

    private static final double TOLERANCE = 1e-6;

    public ConfidenceWeights {
        if (rule < 0.0 || precedent < 0.0 || evidence < 0.0) {
            throw new IllegalArgumentException("confidence weights must not be negative");
        }
        if (Math.abs(rule + precedent + evidence - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException(
                "confidence weights must sum to 1: " + rule + " + " + precedent + " + " + evidence);
        }
    }

    public static ConfidenceWeights defaults() {
        return new ConfidenceWeights(0.5, 0.3, 0.2);
    }
}
