package com.trademind.analysis.service;

import com.trademind.common.model.Signal;

/** Result of polling one agent for one tick. {@code signal} is set only when SIGNALLED. */
public record AgentResponse(
    String agentId,
    Status status,
    Signal signal,
    String error,
    long latencyMs
) {
    public enum Status { SIGNALLED, ABSTAINED, TIMED_OUT, FAILED }

    public static AgentResponse signalled(String agentId, Signal signal, long latencyMs) {
        return new AgentResponse(agentId, Status.SIGNALLED, signal, null, latencyMs);
    }

    public static AgentResponse abstained(String agentId, long latencyMs) {
        return new AgentResponse(agentId, Status.ABSTAINED, null, null, latencyMs);
    }

    public static AgentResponse timedOut(String agentId, long latencyMs) {
        return new AgentResponse(agentId, Status.TIMED_OUT, null, "timed out", latencyMs);
    }

    public static AgentResponse failed(String agentId, String error, long latencyMs) {
        return new AgentResponse(agentId, Status.FAILED, null, error, latencyMs);
    }

    public boolean isFault() {
        return status == Status.TIMED_OUT || status == Status.FAILED;
    }
}
