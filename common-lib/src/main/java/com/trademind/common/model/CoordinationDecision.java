package com.trademind.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one coordination tick. {@code outcome} starts as PENDING for approved
 * actions and NEUTRAL for everything else.
 */
public record CoordinationDecision(
    @JsonProperty("decisionId")            String decisionId,
    @JsonProperty("tickId")                String tickId,
    @JsonProperty("timestamp")             Instant timestamp,
    @JsonProperty("contributingSignalIds") List<String> contributingSignalIds,
    @JsonProperty("consensusScore")        double consensusScore,
    @JsonProperty("verdict")               RiskVerdict verdict,
    @JsonProperty("action")                ProposedAction action,
    @JsonProperty("violations")            List<String> violations,
    @JsonProperty("degraded")              boolean degraded,
    @JsonProperty("outcome")               OutcomeLabel outcome
) {
    public CoordinationDecision {
        contributingSignalIds = contributingSignalIds == null ? List.of() : List.copyOf(contributingSignalIds);
        violations = violations == null ? List.of() : List.copyOf(violations);
        action = action == null ? ProposedAction.NO_OP : action;
    }

    public CoordinationDecision withOutcome(OutcomeLabel label) {
        return new CoordinationDecision(decisionId, tickId, timestamp, contributingSignalIds,
                                        consensusScore, verdict, action, violations, degraded, label);
    }

    /** True when execution agents should act on this decision. */
    @JsonIgnore
    public boolean isActionable() {
        return verdict == RiskVerdict.APPROVED && !action.isNoOp();
    }
}
