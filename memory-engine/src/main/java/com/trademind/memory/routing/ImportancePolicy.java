package com.trademind.memory.routing;

import com.trademind.common.exception.ConfigurationException;
import com.trademind.common.model.EventKind;

/**
 * Memory admission score:
 * <pre>
 *   importance = kindWeight × base(kind) + significanceWeight × significance + noveltyWeight × novelty
 * </pre>
 * clamped to {@code [0, 1]}. Events scoring at or above {@code threshold} are persisted.
 */
public record ImportancePolicy(double kindWeight, double significanceWeight, double noveltyWeight,
                               double threshold, double coordinatorSignificance) {

    public ImportancePolicy {
        if (kindWeight < 0 || significanceWeight < 0 || noveltyWeight < 0) {
            throw new ConfigurationException("importance weights must be non-negative");
        }
        if (kindWeight + significanceWeight + noveltyWeight <= 0) {
            throw new ConfigurationException("importance weights must not all be zero");
        }
        if (threshold < 0 || threshold > 1) {
            throw new ConfigurationException("importance threshold must be within [0, 1]: " + threshold);
        }
    }

    public static ImportancePolicy defaults() {
        return new ImportancePolicy(0.5, 0.2, 0.3, 0.45, 1.0);
    }

    public double score(EventKind kind, double significance, double novelty) {
        double raw = kindWeight * kind.baseImportance()
                   + significanceWeight * clamp(significance)
                   + noveltyWeight * clamp(novelty);
        return clamp(raw);
    }

    public boolean admits(double importance) {
        return importance >= threshold;
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
