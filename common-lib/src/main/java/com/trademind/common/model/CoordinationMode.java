package com.trademind.common.model;

/**
 * Operating posture of the coordinator. Each mode fixes the minimum consensus an action
 * needs to be approved and the largest position fraction it may size to.
 */
public enum CoordinationMode {
    CONSERVATIVE(0.75, 0.03),
    BALANCED(0.60, 0.05),
    AGGRESSIVE(0.50, 0.07),
    AUTONOMOUS(0.40, 0.10);

    private static final double BASE_POSITION_FRACTION = 0.02;
    private static final double CONFIDENCE_POSITION_FRACTION = 0.03;

    private final double consensusThreshold;
    private final double maxPositionFraction;

    CoordinationMode(double consensusThreshold, double maxPositionFraction) {
        this.consensusThreshold = consensusThreshold;
        this.maxPositionFraction = maxPositionFraction;
    }

    public double consensusThreshold() {
        return consensusThreshold;
    }

    public double maxPositionFraction() {
        return maxPositionFraction;
    }

    /** {@code min(maxPositionFraction, 0.02 + consensus * 0.03)}. */
    public double positionSize(double consensus) {
        double raw = BASE_POSITION_FRACTION + Math.max(0.0, consensus) * CONFIDENCE_POSITION_FRACTION;
        return Math.min(maxPositionFraction, raw);
    }
}
