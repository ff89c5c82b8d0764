package com.trademind.common.exception;

import java.time.Duration;

/** An agent did not answer a poll within its per-agent deadline. */
public class AgentTimeoutException extends AgentException {
    private final String tickId;
    private final Duration timeout;

    public AgentTimeoutException(String agentId, String tickId, Duration timeout) {
        super(agentId, "no signal within " + timeout.toMillis() + "ms for tick " + tickId);
        this.tickId = tickId;
        this.timeout = timeout;
    }

    public String getTickId() {
        return tickId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
