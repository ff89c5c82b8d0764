package com.trademind.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time quote for one symbol. {@code recentCloses} is ordered newest first.
 */
public record MarketQuote(
    @JsonProperty("symbol")        String symbol,
    @JsonProperty("price")         double price,
    @JsonProperty("changePercent") double changePercent,
    @JsonProperty("volume")        long volume,
    @JsonProperty("volatility")    double volatility,
    @JsonProperty("recentCloses")  List<Double> recentCloses,
    @JsonProperty("timestamp")     Instant timestamp
) {
    public MarketQuote {
        recentCloses = recentCloses == null ? List.of() : List.copyOf(recentCloses);
    }
}
