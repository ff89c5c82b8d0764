package com.trademind.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Portfolio risk snapshot attached to signals from risk-role agents. Exposure values are
 * signed position fractions per symbol (long positive, short negative).
 */
public record RiskReport(
    @JsonProperty("openPositions")  int openPositions,
    @JsonProperty("dailyLoss")      double dailyLoss,
    @JsonProperty("symbolExposure") Map<String, Double> symbolExposure
) {
    public RiskReport {
        symbolExposure = symbolExposure == null ? Map.of() : Map.copyOf(symbolExposure);
    }

    public static RiskReport empty() {
        return new RiskReport(0, 0.0, Map.of());
    }

    public double exposureFor(String symbol) {
        return symbolExposure.getOrDefault(symbol, 0.0);
    }

    /**
     * Combines two reports keeping the worst value of each measure: most open positions,
     * largest loss, and per symbol the exposure with the greatest magnitude.
     */
    public RiskReport worst(RiskReport other) {
        if (other == null) return this;
        Map<String, Double> merged = new HashMap<>(symbolExposure);
        other.symbolExposure.forEach((symbol, exposure) ->
            merged.merge(symbol, exposure, (a, b) -> Math.abs(a) >= Math.abs(b) ? a : b));
        return new RiskReport(
            Math.max(openPositions, other.openPositions),
            Math.max(dailyLoss, other.dailyLoss),
            merged);
    }
}
