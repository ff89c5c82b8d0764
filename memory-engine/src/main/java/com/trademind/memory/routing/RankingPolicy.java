package com.trademind.memory.routing;

import com.trademind.common.exception.ConfigurationException;

import java.time.Duration;

/**
 * Re-ranking of similarity hits:
 * <pre>
 *   score   = similarityWeight × similarity + recencyWeight × recency + importanceWeight × importance
 *   recency = 0.5 ^ (age / halfLife)
 * </pre>
 */
public record RankingPolicy(double similarityWeight, double recencyWeight, double importanceWeight,
                            Duration halfLife, int overFetchFactor, int defaultK, int cacheSize) {

    public RankingPolicy {
        if (similarityWeight < 0 || recencyWeight < 0 || importanceWeight < 0) {
            throw new ConfigurationException("ranking weights must be non-negative");
        }
        if (halfLife == null || halfLife.isZero() || halfLife.isNegative()) {
            throw new ConfigurationException("recency half-life must be positive");
        }
        if (overFetchFactor < 1 || defaultK < 1 || cacheSize < 1) {
            throw new ConfigurationException("over-fetch factor, default k and cache size must be at least 1");
        }
    }

    public static RankingPolicy defaults() {
        return new RankingPolicy(0.6, 0.25, 0.15, Duration.ofHours(24), 3, 5, 100);
    }

    public double recency(Duration age) {
        double ageMillis = Math.max(0, age.toMillis());
        return Math.pow(0.5, ageMillis / (double) halfLife.toMillis());
    }

    /** @param recencyBias replaces {@code recencyWeight} when non-null */
    public double score(double similarity, Duration age, double importance, Double recencyBias) {
        double rw = recencyBias != null ? Math.max(0.0, recencyBias) : recencyWeight;
        return similarityWeight * similarity + rw * recency(age) + importanceWeight * importance;
    }
}
