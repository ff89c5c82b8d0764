package com.trademind.orchestrator.config;

import com.trademind.analysis.agent.AgentDefinition;
import com.trademind.common.model.CoordinationMode;
import com.trademind.orchestrator.pipeline.RiskLimits;
import com.trademind.orchestrator.pipeline.WeightAdjuster;

import java.time.Duration;
import java.util.List;

/** Validated, immutable coordinator configuration. */
public record CoordinatorSettings(
    List<AgentDefinition> agents,
    List<String> watchlist,
    CoordinationMode mode,
    Duration tickDeadline,
    Duration agentTimeout,
    Duration healthTimeout,
    Duration outcomeTimeout,
    double minActiveFraction,
    double degradedConsensusCeiling,
    RiskLimits riskLimits,
    WeightAdjuster weightAdjuster
) {
    public CoordinatorSettings {
        agents = List.copyOf(agents);
        watchlist = List.copyOf(watchlist);
    }
}
