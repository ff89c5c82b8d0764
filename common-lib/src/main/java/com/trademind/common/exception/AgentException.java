package com.trademind.common.exception;

/**
 * Failure raised by, or on behalf of, a single trading agent. The message is prefixed
 * with the agent id so log lines stay attributable.
 */
public class AgentException extends RuntimeException {
    private final String agentId;

    public AgentException(String agentId, String message) {
        super("[" + agentId + "] " + message);
        this.agentId = agentId;
    }

    public AgentException(String agentId, String message, Throwable cause) {
        super("[" + agentId + "] " + message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
