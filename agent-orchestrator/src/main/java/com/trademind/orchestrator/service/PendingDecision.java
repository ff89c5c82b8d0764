package com.trademind.orchestrator.service;

import com.trademind.common.model.CoordinationDecision;

import java.time.Instant;
import java.util.List;

/**
 * An approved decision waiting for its realised outcome.
 *
 * @param recordId           memory record of the decision event, {@code null} if it was not stored
 * @param supportingAgentIds agents whose signals backed the chosen action; their weights learn from the outcome
 */
public record PendingDecision(
    CoordinationDecision decision,
    String recordId,
    List<String> supportingAgentIds,
    Instant registeredAt
) {
    public PendingDecision {
        supportingAgentIds = List.copyOf(supportingAgentIds);
    }

    public String decisionId() {
        return decision.decisionId();
    }
}
