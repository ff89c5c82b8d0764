package com.trademind.common.model;

public enum OutcomeLabel {
    SUCCESS,
    FAILURE,
    NEUTRAL,
    PENDING;

    public boolean isResolved() {
        return this != PENDING;
    }

    /** Classifies realised P&amp;L; a flat result is NEUTRAL. */
    public static OutcomeLabel fromPnl(double pnl) {
        if (pnl > 0.0) return SUCCESS;
        if (pnl < 0.0) return FAILURE;
        return NEUTRAL;
    }
}
