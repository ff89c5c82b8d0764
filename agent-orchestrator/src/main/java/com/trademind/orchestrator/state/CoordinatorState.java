package com.trademind.orchestrator.state;

import com.trademind.common.model.CoordinationMode;
import com.trademind.common.model.LivenessState;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Immutable coordinator state handed into and returned from a tick. Every mutator returns
 * a new instance; agent order is registration order.
 */
public final class CoordinatorState {

    private final Map<String, AgentStatus> agents;
    private final CoordinationMode mode;
    private final boolean degraded;
    private final long tickCount;

    public CoordinatorState(Map<String, AgentStatus> agents, CoordinationMode mode, boolean degraded, long tickCount) {
        this.agents = Collections.unmodifiableMap(new LinkedHashMap<>(agents));
        this.mode = mode;
        this.degraded = degraded;
        this.tickCount = tickCount;
    }

    public static CoordinatorState initial(Collection<AgentStatus> agents, CoordinationMode mode) {
        Map<String, AgentStatus> map = new LinkedHashMap<>();
        agents.forEach(a -> map.put(a.agentId(), a));
        return new CoordinatorState(map, mode, false, 0L);
    }

    public Map<String, AgentStatus> agents() {
        return agents;
    }

    public List<AgentStatus> agentList() {
        return List.copyOf(agents.values());
    }

    public AgentStatus agent(String agentId) {
        return agents.get(agentId);
    }

    public CoordinationMode mode() {
        return mode;
    }

    public boolean degraded() {
        return degraded;
    }

    public long tickCount() {
        return tickCount;
    }

    /** Agent id to current weight. */
    public Map<String, Double> weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        agents.values().forEach(a -> weights.put(a.agentId(), a.weight()));
        return weights;
    }

    public double activeFraction() {
        if (agents.isEmpty()) return 0.0;
        long active = agents.values().stream().filter(a -> a.liveness() == LivenessState.ACTIVE).count();
        return active / (double) agents.size();
    }

    // ── transitions ──────────────────────────────────────────────────────────

    public CoordinatorState withAgent(String agentId, UnaryOperator<AgentStatus> change) {
        AgentStatus current = agents.get(agentId);
        if (current == null) return this;
        Map<String, AgentStatus> next = new LinkedHashMap<>(agents);
        next.put(agentId, change.apply(current));
        return new CoordinatorState(next, mode, degraded, tickCount);
    }

    public CoordinatorState withLiveness(String agentId, LivenessState liveness) {
        return withAgent(agentId, a -> a.withLiveness(liveness));
    }

    public CoordinatorState withWeight(String agentId, double weight) {
        return withAgent(agentId, a -> a.withWeight(weight));
    }

    public CoordinatorState withMode(CoordinationMode next) {
        return new CoordinatorState(agents, next, degraded, tickCount);
    }

    public CoordinatorState withDegraded(boolean next) {
        return new CoordinatorState(agents, mode, next, tickCount);
    }

    public CoordinatorState nextTick() {
        return new CoordinatorState(agents, mode, degraded, tickCount + 1);
    }

    /**
     * Applies the liveness changes a tick made, from {@code tickInput} to {@code tickResult},
     * onto this state. Agents the tick left alone keep their current liveness, and a STOPPED
     * agent stays STOPPED. Weights and mode are kept from this state, since they may have
     * changed while the tick ran.
     */
    public CoordinatorState mergeTick(CoordinatorState tickInput, CoordinatorState tickResult) {
        Map<String, AgentStatus> next = new LinkedHashMap<>(agents);
        tickResult.agents.forEach((id, status) -> {
            AgentStatus seen = tickInput.agents.get(id);
            if (seen != null && seen.liveness() == status.liveness()) return;
            next.computeIfPresent(id, (k, mine) -> mine.liveness() == LivenessState.STOPPED
                ? mine
                : mine.withLiveness(status.liveness()));
        });
        return new CoordinatorState(next, mode, tickResult.degraded, Math.max(tickCount, tickResult.tickCount));
    }
}
