package com.trademind.orchestrator.service;

import com.trademind.analysis.service.AgentResponse;
import com.trademind.common.consensus.ConsensusResult;
import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.Signal;
import com.trademind.orchestrator.pipeline.RiskAssessment;
import com.trademind.orchestrator.state.CoordinatorState;

import java.util.List;

/** Everything one completed tick produced. {@code state} carries its liveness changes. */
public record TickResult(
    CoordinatorState state,
    CoordinationDecision decision,
    List<AgentResponse> responses,
    List<Signal> signals,
    ConsensusResult consensus,
    RiskAssessment risk,
    List<String> supportingAgentIds
) {
}
