package com.trademind.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** The concrete trade a decision carries. A HOLD or symbol-less action is a no-op. */
public record ProposedAction(
    @JsonProperty("symbol")       String symbol,
    @JsonProperty("action")       TradeAction action,
    @JsonProperty("positionSize") double positionSize
) {
    public static final ProposedAction NO_OP = new ProposedAction(null, TradeAction.HOLD, 0.0);

    public static ProposedAction of(String symbol, TradeAction action, double positionSize) {
        return new ProposedAction(symbol, action, positionSize);
    }

    @JsonIgnore
    public boolean isNoOp() {
        return symbol == null || action == null || action == TradeAction.HOLD;
    }

    /** Position size signed by direction: positive long, negative short. */
    @JsonIgnore
    public double signedSize() {
        return isNoOp() ? 0.0 : action.direction() * positionSize;
    }
}
