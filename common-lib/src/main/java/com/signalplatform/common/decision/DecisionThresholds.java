package com.signalplatform.common.decision;

/**
 * Score thresholds applied to the normalized weighted score, which lives in [-1, +1].
 *
 * <pre>
 *   normalizedScore &ge; +upThreshold   → UP
 *   normalizedScore &le; −downThreshold → DOWN
 *   otherwise                          → SKIP
 * </pre>
 *
 * Both thresholds must be in (0, 1].
 */
public record DecisionThresholds(double upThreshold, double downThreshold) {

    public static final double DEFAULT_THRESHOLD = 0.3;

    public DecisionThresholds {
        requireThreshold("upThreshold", upThreshold);
        requireThreshold("downThreshold", downThreshold);
    }

    public static DecisionThresholds defaults() {
        return new DecisionThresholds(DEFAULT_THRESHOLD, DEFAULT_THRESHOLD);
    }

    public static DecisionThresholds symmetric(double threshold) {
        return new DecisionThresholds(threshold, threshold);
    }

    private static void requireThreshold(String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in (0, 1], was " + value);
        }
    }
}
