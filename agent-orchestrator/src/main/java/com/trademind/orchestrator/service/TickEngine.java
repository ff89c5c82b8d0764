package com.trademind.orchestrator.service;

import com.trademind.analysis.service.AgentDispatchService;
import com.trademind.analysis.service.AgentResponse;
import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.consensus.CandidateScore;
import com.trademind.common.consensus.ConsensusEngine;
import com.trademind.common.consensus.ConsensusResult;
import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.CoordinationMode;
import com.trademind.common.model.LivenessState;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.ProposedAction;
import com.trademind.common.model.RiskVerdict;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import com.trademind.orchestrator.config.CoordinatorSettings;
import com.trademind.orchestrator.logger.CoordinationFlowLogger;
import com.trademind.orchestrator.pipeline.DecisionPolicy;
import com.trademind.orchestrator.pipeline.RiskAssessment;
import com.trademind.orchestrator.pipeline.RiskGate;
import com.trademind.orchestrator.state.AgentStatus;
import com.trademind.orchestrator.state.CoordinatorPhase;
import com.trademind.orchestrator.state.CoordinatorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * One pass of collecting → scoring → gating → deciding over an owned
 * {@link CoordinatorState}. The input state is never modified; liveness changes come back
 * in {@link TickResult#state()}.
 *
 * <p>Signals from risk-role agents carry risk reports for the gate and take no part in
 * consensus scoring.
 */
public class TickEngine {

    private static final Logger log = LoggerFactory.getLogger(TickEngine.class);

    private final AgentDirectory directory;
    private final AgentDispatchService dispatcher;
    private final ConsensusEngine consensusEngine;
    private final RiskGate riskGate;
    private final CoordinatorSettings settings;
    private final CoordinationFlowLogger flowLogger;
    private final Clock clock;

    public TickEngine(AgentDirectory directory, AgentDispatchService dispatcher, ConsensusEngine consensusEngine,
                      RiskGate riskGate, CoordinatorSettings settings, CoordinationFlowLogger flowLogger,
                      Clock clock) {
        this.directory = directory;
        this.dispatcher = dispatcher;
        this.consensusEngine = consensusEngine;
        this.riskGate = riskGate;
        this.settings = settings;
        this.flowLogger = flowLogger;
        this.clock = clock;
    }

    public Mono<TickResult> run(CoordinatorState state, TickContext context, Consumer<CoordinatorPhase> phases) {
        return Mono.defer(() -> {
            phases.accept(CoordinatorPhase.COLLECTING);
            List<TradingAgent> pollable = directory.all().stream()
                .filter(agent -> {
                    AgentStatus status = state.agent(agent.agentId());
                    return status != null && status.liveness().isPollable();
                })
                .toList();
            return dispatcher.dispatch(pollable, context, settings.agentTimeout())
                .doOnEach(flowLogger.stage(CoordinationFlowLogger.AGENTS_POLLED))
                .map(responses -> evaluate(state, context, responses, phases));
        });
    }

    // ── scoring / gating / deciding ──────────────────────────────────────────

    private TickResult evaluate(CoordinatorState state, TickContext context,
                                List<AgentResponse> responses, Consumer<CoordinatorPhase> phases) {
        CoordinatorState next = applyLiveness(state, responses);
        boolean degraded = next.activeFraction() < settings.minActiveFraction();
        next = next.withDegraded(degraded).nextTick();

        phases.accept(CoordinatorPhase.SCORING);
        List<Signal> signals = new ArrayList<>();
        List<Signal> riskSignals = new ArrayList<>();
        List<Signal> votes = new ArrayList<>();
        for (AgentResponse response : responses) {
            if (response.status() != AgentResponse.Status.SIGNALLED) continue;
            Signal signal = response.signal();
            signals.add(signal);
            AgentStatus status = state.agent(signal.agentId());
            if (status != null && status.kind().isRisk()) riskSignals.add(signal);
            else votes.add(signal);
        }
        ConsensusResult consensus = consensusEngine.compute(votes, state.weights());
        double score = consensus.consensusScore();
        if (degraded && score > settings.degradedConsensusCeiling()) {
            log.info("[TickEngine] Consensus capped while degraded. tickId={} raw={} ceiling={}",
                     context.tickId(), score, settings.degradedConsensusCeiling());
            score = settings.degradedConsensusCeiling();
        }

        CoordinationMode mode = state.mode();
        ProposedAction action = ProposedAction.NO_OP;
        if (consensus.hasAction()) {
            CandidateScore chosen = consensus.chosen();
            action = ProposedAction.of(chosen.symbol(), chosen.action(), mode.positionSize(score));
        }
        flowLogger.logStage(CoordinationFlowLogger.CONSENSUS_SCORED, context.tickId());

        phases.accept(CoordinatorPhase.GATING);
        boolean riskRegistered = state.agents().values().stream().anyMatch(a -> a.kind().isRisk());
        RiskAssessment risk = riskGate.evaluate(action, riskSignals, riskRegistered);
        flowLogger.logStage(CoordinationFlowLogger.RISK_GATED, context.tickId());

        phases.accept(CoordinatorPhase.DECIDING);
        RiskVerdict verdict = DecisionPolicy.decide(score, mode.consensusThreshold(), action, risk);
        boolean actionable = verdict == RiskVerdict.APPROVED && !action.isNoOp();
        CoordinationDecision decision = new CoordinationDecision(
            UUID.randomUUID().toString(),
            context.tickId(),
            clock.instant(),
            consensus.contributingSignalIds(),
            score,
            verdict,
            action,
            risk.violations(),
            degraded,
            actionable ? OutcomeLabel.PENDING : OutcomeLabel.NEUTRAL);

        return new TickResult(next, decision, responses, signals, consensus, risk,
                              supportingAgents(consensus, signals));
    }

    private static CoordinatorState applyLiveness(CoordinatorState state, List<AgentResponse> responses) {
        CoordinatorState next = state;
        for (AgentResponse response : responses) {
            if (response.status() == AgentResponse.Status.TIMED_OUT) {
                next = next.withLiveness(response.agentId(), LivenessState.DEGRADED);
            } else if (response.status() == AgentResponse.Status.FAILED) {
                next = next.withLiveness(response.agentId(), LivenessState.ERRORED);
            }
        }
        return next;
    }

    private static List<String> supportingAgents(ConsensusResult consensus, List<Signal> signals) {
        if (!consensus.hasAction()) return List.of();
        Map<String, String> agentBySignal = new HashMap<>();
        signals.forEach(s -> agentBySignal.put(s.signalId(), s.agentId()));
        LinkedHashSet<String> agents = new LinkedHashSet<>();
        for (String signalId : consensus.chosen().supportingSignalIds()) {
            String agentId = agentBySignal.get(signalId);
            if (agentId != null) agents.add(agentId);
        }
        return List.copyOf(agents);
    }
}
