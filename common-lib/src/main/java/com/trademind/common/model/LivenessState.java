package com.trademind.common.model;

public enum LivenessState {
    STARTING,
    ACTIVE,
    DEGRADED,
    STOPPED,
    ERRORED;

    /** Only ACTIVE agents are polled during a tick. */
    public boolean isPollable() {
        return this == ACTIVE;
    }

    /** States a successful health probe at tick start may lift back to ACTIVE. */
    public boolean isRecoverable() {
        return this == DEGRADED || this == ERRORED || this == STARTING;
    }
}
