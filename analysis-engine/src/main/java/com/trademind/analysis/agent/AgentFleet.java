package com.trademind.analysis.agent;

import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.agent.TradingAgent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered agents in registration order. Starts empty so it can be handed to the memory
 * routers before the agents themselves (which need memory access) exist.
 */
public class AgentFleet implements AgentDirectory {

    private final Map<String, TradingAgent> agents = new LinkedHashMap<>();

    public synchronized void register(TradingAgent agent) {
        if (agents.containsKey(agent.agentId())) {
            throw new IllegalArgumentException("duplicate agent id: " + agent.agentId());
        }
        agents.put(agent.agentId(), agent);
    }

    @Override
    public synchronized List<TradingAgent> all() {
        return List.copyOf(new ArrayList<>(agents.values()));
    }

    @Override
    public synchronized Optional<TradingAgent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public synchronized int size() {
        return agents.size();
    }
}
