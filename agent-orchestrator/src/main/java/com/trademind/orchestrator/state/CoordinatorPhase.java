package com.trademind.orchestrator.state;

public enum CoordinatorPhase {
    IDLE,
    COLLECTING,
    SCORING,
    GATING,
    DECIDING,
    AWAITING_OUTCOME,
    STOPPED
}
