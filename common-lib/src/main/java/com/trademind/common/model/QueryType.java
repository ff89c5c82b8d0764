package com.trademind.common.model;

import java.util.List;

/**
 * Retrieval intents. Each contributes expansion terms appended to the query text before
 * embedding so that short agent queries land near the records they are looking for.
 */
public enum QueryType {
    TRADING_SIGNALS(List.of("signal", "buy", "sell", "confidence", "entry")),
    MARKET_ANALYSIS(List.of("market", "price", "volume", "volatility", "trend")),
    RISK_ASSESSMENT(List.of("risk", "exposure", "drawdown", "loss", "position")),
    STRATEGY_PERFORMANCE(List.of("outcome", "success", "failure", "pnl", "performance")),
    COORDINATION_DECISIONS(List.of("decision", "consensus", "approved", "rejected", "deferred")),
    GENERAL(List.of());

    private final List<String> expansionTerms;

    QueryType(List<String> expansionTerms) {
        this.expansionTerms = expansionTerms;
    }

    public List<String> expansionTerms() {
        return expansionTerms;
    }

    public String expand(String text) {
        if (expansionTerms.isEmpty()) return text;
        return text + " " + String.join(" ", expansionTerms);
    }
}
