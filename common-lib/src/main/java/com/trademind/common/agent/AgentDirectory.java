package com.trademind.common.agent;

import com.trademind.common.model.AgentCategory;

import java.util.List;
import java.util.Optional;

/** Lookup of the registered agent fleet. */
public interface AgentDirectory {

    List<TradingAgent> all();

    Optional<TradingAgent> find(String agentId);

    /** Agents whose interests contain {@code category}, excluding {@code excludeAgentId}. */
    default List<TradingAgent> subscribersOf(AgentCategory category, String excludeAgentId) {
        return all().stream()
            .filter(agent -> !agent.agentId().equals(excludeAgentId))
            .filter(agent -> agent.interests().contains(category))
            .toList();
    }
}
