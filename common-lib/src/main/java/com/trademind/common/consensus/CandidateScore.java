package com.trademind.common.consensus;

import com.trademind.common.model.TradeAction;

import java.util.List;

/** Consensus score of one (symbol, action) pair and the signals supporting it. */
public record CandidateScore(
    String symbol,
    TradeAction action,
    double consensus,
    double weightedRisk,
    List<String> supportingSignalIds
) {
    public CandidateScore {
        supportingSignalIds = List.copyOf(supportingSignalIds);
    }
}
