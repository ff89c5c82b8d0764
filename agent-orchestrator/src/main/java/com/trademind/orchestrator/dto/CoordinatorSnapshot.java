package com.trademind.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trademind.common.model.CoordinationMode;
import com.trademind.memory.routing.CommunicationStats;
import com.trademind.memory.routing.RetrievalStats;
import com.trademind.memory.store.StoreStatus;
import com.trademind.orchestrator.state.AgentStatus;
import com.trademind.orchestrator.state.CoordinatorPhase;
import com.trademind.orchestrator.state.PerformanceCounters;

import java.time.Instant;
import java.util.List;

/** Read-only view served by {@code GET /api/v1/coordinator/snapshot}. */
public record CoordinatorSnapshot(
    @JsonProperty("phase")            CoordinatorPhase phase,
    @JsonProperty("mode")             CoordinationMode mode,
    @JsonProperty("degraded")         boolean degraded,
    @JsonProperty("activeFraction")   double activeFraction,
    @JsonProperty("tickCount")        long tickCount,
    @JsonProperty("lastTickId")       String lastTickId,
    @JsonProperty("lastTickAt")       Instant lastTickAt,
    @JsonProperty("watchlist")        List<String> watchlist,
    @JsonProperty("agents")           List<AgentStatus> agents,
    @JsonProperty("pendingOutcomes")  int pendingOutcomes,
    @JsonProperty("learningBacklog")  int learningBacklog,
    @JsonProperty("performance")      PerformanceCounters performance,
    @JsonProperty("store")            StoreStatus store,
    @JsonProperty("communication")    CommunicationStats communication,
    @JsonProperty("retrieval")        RetrievalStats retrieval
) {
}
