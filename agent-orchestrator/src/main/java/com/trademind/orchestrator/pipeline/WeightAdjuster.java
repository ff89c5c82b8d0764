package com.trademind.orchestrator.pipeline;

import com.trademind.common.model.OutcomeLabel;

/**
 * Outcome-driven agent weight update, bounded to {@code [0, 2]}.
 *
 * <ul>
 *   <li>SUCCESS: {@code w + step}</li>
 *   <li>FAILURE: {@code w - min(step, w * maxDecayFraction)}; never reaches zero from a
 *       positive weight in one step</li>
 *   <li>NEUTRAL / PENDING: unchanged</li>
 * </ul>
 */
public record WeightAdjuster(double step, double maxDecayFraction) {

    public static final double MIN_WEIGHT = 0.0;
    public static final double MAX_WEIGHT = 2.0;

    public double adjust(double weight, OutcomeLabel label) {
        double next = switch (label) {
            case SUCCESS -> weight + step;
            case FAILURE -> weight - Math.min(step, weight * maxDecayFraction);
            case NEUTRAL, PENDING -> weight;
        };
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, next));
    }
}
