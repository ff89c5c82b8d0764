package com.trademind.orchestrator.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.LivenessState;

/** Coordinator-owned view of one registered agent. */
public record AgentStatus(
    @JsonProperty("agentId")  String agentId,
    @JsonProperty("kind")     AgentKind kind,
    @JsonProperty("category") AgentCategory category,
    @JsonProperty("weight")   double weight,
    @JsonProperty("liveness") LivenessState liveness
) {
    public static AgentStatus starting(String agentId, AgentKind kind, double weight) {
        return new AgentStatus(agentId, kind, kind.category(), weight, LivenessState.STARTING);
    }

    public AgentStatus withWeight(double w) {
        return new AgentStatus(agentId, kind, category, w, liveness);
    }

    public AgentStatus withLiveness(LivenessState state) {
        return new AgentStatus(agentId, kind, category, weight, state);
    }
}
