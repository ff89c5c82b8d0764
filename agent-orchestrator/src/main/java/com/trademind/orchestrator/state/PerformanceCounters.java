package com.trademind.orchestrator.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.RiskVerdict;

/** Running coordination totals. Immutable; the coordinator swaps instances atomically. */
public record PerformanceCounters(
    @JsonProperty("decisions")  long decisions,
    @JsonProperty("approved")   long approved,
    @JsonProperty("rejected")   long rejected,
    @JsonProperty("deferred")   long deferred,
    @JsonProperty("successes")  long successes,
    @JsonProperty("failures")   long failures,
    @JsonProperty("neutral")    long neutral,
    @JsonProperty("totalPnl")   double totalPnl
) {
    public static final PerformanceCounters ZERO = new PerformanceCounters(0, 0, 0, 0, 0, 0, 0, 0.0);

    public PerformanceCounters withDecision(RiskVerdict verdict) {
        return new PerformanceCounters(decisions + 1,
            approved + (verdict == RiskVerdict.APPROVED ? 1 : 0),
            rejected + (verdict == RiskVerdict.REJECTED ? 1 : 0),
            deferred + (verdict == RiskVerdict.DEFERRED ? 1 : 0),
            successes, failures, neutral, totalPnl);
    }

    public PerformanceCounters withOutcome(OutcomeLabel label, double pnl) {
        return new PerformanceCounters(decisions, approved, rejected, deferred,
            successes + (label == OutcomeLabel.SUCCESS ? 1 : 0),
            failures + (label == OutcomeLabel.FAILURE ? 1 : 0),
            neutral + (label == OutcomeLabel.NEUTRAL ? 1 : 0),
            totalPnl + pnl);
    }

    /** Successes over resolved non-neutral outcomes; 0 before any. */
    @JsonProperty("accuracy")
    public double accuracy() {
        long decided = successes + failures;
        return decided == 0 ? 0.0 : successes / (double) decided;
    }
}
