package com.trademind.orchestrator.service;

import com.trademind.analysis.agent.AgentDefinition;
import com.trademind.analysis.agent.AgentFactory;
import com.trademind.analysis.agent.AgentFleet;
import com.trademind.analysis.agent.OutcomeRelay;
import com.trademind.analysis.market.MarketFeed;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.exception.ConfigurationException;
import com.trademind.common.exception.DegradedDependencyException;
import com.trademind.common.exception.ValidationException;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.CoordinationDecision;
import com.trademind.common.model.CoordinationMode;
import com.trademind.common.model.LivenessState;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import com.trademind.common.trace.TraceContextUtil;
import com.trademind.memory.routing.AgentInputRouter;
import com.trademind.memory.routing.AgentOutputRouter;
import com.trademind.memory.store.VectorMemoryStore;
import com.trademind.orchestrator.config.CoordinatorSettings;
import com.trademind.orchestrator.dto.CoordinatorSnapshot;
import com.trademind.orchestrator.logger.CoordinationFlowLogger;
import com.trademind.orchestrator.state.AgentStatus;
import com.trademind.orchestrator.state.CoordinatorPhase;
import com.trademind.orchestrator.state.CoordinatorState;
import com.trademind.orchestrator.state.PerformanceCounters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Owns the coordination lifecycle: agent registration and liveness, tick execution,
 * decision hand-off, outcome resolution and weight learning.
 *
 * <p>State machine:
 * <pre>
 *   IDLE → COLLECTING → SCORING → GATING → DECIDING → AWAITING_OUTCOME | IDLE
 * </pre>
 * The phases between COLLECTING and DECIDING are driven by {@link TickEngine}. One tick
 * runs at a time; a tick that overruns its deadline is abandoned without a decision and
 * without state changes.
 *
 * <p>Outcome learning never blocks ticks. When memory is unavailable the resolution is
 * parked in the {@link LearningBacklog} and replayed by {@link #retryDeferredLearning()}.
 */
@Service
public class AgentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AgentCoordinator.class);
    private static final int JOURNAL_CAPACITY = 500;
    private static final int MAX_LEARNING_ATTEMPTS = 10;

    private final CoordinatorSettings settings;
    private final AgentFleet fleet;
    private final AgentFactory factory;
    private final OutcomeRelay outcomeRelay;
    private final TickEngine tickEngine;
    private final MarketFeed feed;
    private final AgentOutputRouter outputRouter;
    private final AgentInputRouter inputRouter;
    private final VectorMemoryStore store;
    private final CoordinationFlowLogger flowLogger;
    private final Clock clock;

    private final PendingDecisionTable pending = new PendingDecisionTable();
    private final DecisionJournal journal = new DecisionJournal(JOURNAL_CAPACITY);
    private final LearningBacklog backlog = new LearningBacklog(MAX_LEARNING_ATTEMPTS);

    private final AtomicReference<CoordinatorState> state = new AtomicReference<>();
    private final AtomicReference<PerformanceCounters> counters = new AtomicReference<>(PerformanceCounters.ZERO);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean tickInFlight = new AtomicBoolean(false);
    private final AtomicLong tickSequence = new AtomicLong();
    private final Object weightLock = new Object();

    private volatile CoordinatorPhase phase = CoordinatorPhase.STOPPED;
    private volatile String lastTickId;
    private volatile Instant lastTickAt;

    public AgentCoordinator(
            CoordinatorSettings settings,
            AgentFleet fleet,
            AgentFactory factory,
            OutcomeRelay outcomeRelay,
            TickEngine tickEngine,
            MarketFeed feed,
            AgentOutputRouter outputRouter,
            AgentInputRouter inputRouter,
            VectorMemoryStore store,
            CoordinationFlowLogger flowLogger,
            Clock clock) {
        this.settings     = settings;
        this.fleet        = fleet;
        this.factory      = factory;
        this.outcomeRelay = outcomeRelay;
        this.tickEngine   = tickEngine;
        this.feed         = feed;
        this.outputRouter = outputRouter;
        this.inputRouter  = inputRouter;
        this.store        = store;
        this.flowLogger   = flowLogger;
        this.clock        = clock;
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    /**
     * Registers the configured agents, binds outcome reporting and probes every agent.
     * Agents that answer their health check become ACTIVE; the rest stay STARTING until a
     * later probe succeeds. Idempotent.
     *
     * @throws ConfigurationException when an agent cannot be built from its definition
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
            if (!started.compareAndSet(false, true)) return Mono.empty();
            List<AgentStatus> statuses = new ArrayList<>();
            for (AgentDefinition definition : settings.agents()) {
                TradingAgent agent;
                try {
                    agent = factory.create(definition);
                } catch (IllegalArgumentException e) {
                    started.set(false);
                    return Mono.error(new ConfigurationException(
                        "agent " + definition.agentId() + " cannot be created: " + e.getMessage(), e));
                }
                fleet.register(agent);
                statuses.add(AgentStatus.starting(definition.agentId(), definition.kind(), definition.initialWeight()));
            }
            state.set(CoordinatorState.initial(statuses, settings.mode()));
            outcomeRelay.bind((decisionId, label, pnl) -> reportOutcome(decisionId, label, pnl).then());
            phase = CoordinatorPhase.IDLE;
            log.info("[Coordinator] Started. agents={} watchlist={} mode={}",
                     statuses.size(), settings.watchlist(), settings.mode());
            return probeRecoverable(null);
        });
    }

    /** Stops ticking and marks every agent STOPPED. Pending outcomes are kept. */
    public void stop() {
        phase = CoordinatorPhase.STOPPED;
        CoordinatorState current = state.get();
        if (current != null) {
            update(s -> {
                CoordinatorState next = s;
                for (String id : s.agents().keySet()) next = next.withLiveness(id, LivenessState.STOPPED);
                return next;
            });
        }
        log.info("[Coordinator] Stopped. pendingOutcomes={} learningBacklog={}", pending.size(), backlog.size());
    }

    public boolean isRunning() {
        return started.get() && phase != CoordinatorPhase.STOPPED;
    }

    // ── tick ─────────────────────────────────────────────────────────────────

    /**
     * Runs one coordination tick. Emits the decision, or completes empty when the tick
     * was skipped (not running, previous tick still in flight) or abandoned.
     */
    public Mono<CoordinationDecision> runTick() {
        return Mono.defer(() -> {
            if (!isRunning()) {
                log.warn("[Coordinator] Tick requested while not running. phase={}", phase);
                return Mono.empty();
            }
            if (!tickInFlight.compareAndSet(false, true)) {
                log.warn("[Coordinator] Tick skipped, previous tick still running. lastTickId={}", lastTickId);
                return Mono.empty();
            }
            String tickId = "tick-" + tickSequence.incrementAndGet() + "-" + UUID.randomUUID().toString().substring(0, 8);
            Instant startedAt = clock.instant();
            lastTickId = tickId;
            lastTickAt = startedAt;
            inputRouter.beginTick(tickId);
            flowLogger.logStage(CoordinationFlowLogger.TICK_STARTED, tickId);

            AtomicReference<TickContext> context = new AtomicReference<>();
            Mono<CoordinationDecision> tick = probeRecoverable(tickId)
                .then(feed.snapshot(settings.watchlist()))
                .map(quotes -> TickContext.of(tickId, startedAt, settings.tickDeadline(), settings.watchlist(), quotes))
                .doOnNext(context::set)
                .flatMap(ctx -> {
                    CoordinatorState input = state.get();
                    return tickEngine.run(input, ctx, this::enterPhase)
                        .flatMap(result -> route(result, input));
                })
                .timeout(settings.tickDeadline())
                .map(this::commit)
                .onErrorResume(TimeoutException.class, e -> {
                    Optional.ofNullable(context.get()).ifPresent(TickContext::cancel);
                    flowLogger.tickAbandoned(tickId, "deadline of " + settings.tickDeadline().toMillis() + "ms exceeded");
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.error("[Coordinator] Tick failed. tickId={} error={}", tickId, e.getMessage(), e);
                    flowLogger.tickAbandoned(tickId, String.valueOf(e.getMessage()));
                    return Mono.empty();
                })
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .doOnNext(ignored -> finishTick())
                .doOnCancel(this::finishTick)
                .flatMap(decision -> decision.map(Mono::just).orElseGet(Mono::empty));
            return TraceContextUtil.withTraceId(tick, tickId);
        });
    }

    /** Routes the tick's signals and decision through memory. Nothing is committed yet. */
    private Mono<Routed> route(TickResult result, CoordinatorState input) {
        CoordinationDecision decision = result.decision();
        AgentEvent event = AgentEvent.decision(decision);
        return publishSignals(result.signals(), result.state())
            .then(outputRouter.ingest(AgentEvent.COORDINATOR_ID, event)
                .map(r -> Optional.ofNullable(r.recordId()))
                .onErrorResume(e -> {
                    log.warn("[Coordinator] Decision not recorded. decisionId={} reason={}",
                             decision.decisionId(), e.getMessage());
                    return Mono.just(Optional.empty());
                }))
            .map(recordId -> new Routed(input, result, event, recordId));
    }

    /**
     * Applies a tick that finished inside its deadline: merges state, journals the
     * decision and, when actionable, registers it as pending and starts the hand-off.
     */
    private CoordinationDecision commit(Routed routed) {
        TickResult result = routed.result();
        CoordinationDecision decision = result.decision();
        CoordinatorState before = state.get();
        CoordinatorState after = update(s -> s.mergeTick(routed.input(), result.state()));
        reportLivenessChanges(decision.tickId(), before, after);
        if (before.degraded() != after.degraded()) {
            flowLogger.degradedTransition(decision.tickId(), after.degraded(), after.activeFraction());
        }

        journal.record(decision);
        counters.updateAndGet(c -> c.withDecision(decision.verdict()));
        flowLogger.decision(decision);

        if (decision.isActionable()) {
            pending.put(new PendingDecision(decision, routed.recordId().orElse(null),
                                            result.supportingAgentIds(), clock.instant()));
            handOff(decision, routed.event()).subscribe(
                null,
                err -> log.warn("[Coordinator] Hand-off failed. decisionId={}", decision.decisionId(), err));
        }
        flowLogger.logStage(CoordinationFlowLogger.TICK_COMPLETED, decision.tickId());
        return decision;
    }

    private record Routed(CoordinatorState input, TickResult result, AgentEvent event, Optional<String> recordId) {}

    private Mono<Void> publishSignals(List<Signal> signals, CoordinatorState current) {
        return Flux.fromIterable(signals)
            .flatMap(signal -> {
                AgentStatus status = current.agent(signal.agentId());
                AgentCategory category = status == null ? AgentCategory.SIGNAL_GENERATION : status.category();
                return outputRouter.ingest(signal.agentId(), AgentEvent.fromSignal(signal, category))
                    .onErrorResume(e -> {
                        log.warn("[Coordinator] Signal not routed. signalId={} agentId={} reason={}",
                                 signal.signalId(), signal.agentId(), e.getMessage());
                        return Mono.empty();
                    });
            })
            .then();
    }

    /** Delivers an approved decision to every ACTIVE execution agent; each venue filters by symbol. */
    private Mono<Void> handOff(CoordinationDecision decision, AgentEvent event) {
        CoordinatorState current = state.get();
        List<TradingAgent> venues = fleet.all().stream()
            .filter(a -> a.kind().isExecution())
            .filter(a -> {
                AgentStatus s = current.agent(a.agentId());
                return s != null && s.liveness() == LivenessState.ACTIVE;
            })
            .toList();
        if (venues.isEmpty()) {
            log.warn("[Coordinator] No active execution agent for approved decision. decisionId={} symbol={}",
                     decision.decisionId(), decision.action().symbol());
            return Mono.empty();
        }
        return Flux.fromIterable(venues)
            .flatMap(agent -> Mono.defer(() -> agent.consumeEvent(event))
                .timeout(settings.agentTimeout())
                .onErrorResume(e -> {
                    log.warn("[Coordinator] Hand-off failed. decisionId={} agentId={} reason={}",
                             decision.decisionId(), agent.agentId(), e.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    // ── liveness ─────────────────────────────────────────────────────────────

    /** Health-probes every recoverable agent; healthy ones return to ACTIVE. */
    private Mono<Void> probeRecoverable(String tickId) {
        CoordinatorState current = state.get();
        return Flux.fromIterable(fleet.all())
            .filter(agent -> {
                AgentStatus status = current.agent(agent.agentId());
                return status != null && status.liveness().isRecoverable();
            })
            .flatMap(agent -> Mono.defer(agent::healthCheck)
                .timeout(settings.healthTimeout())
                .onErrorReturn(false)
                .defaultIfEmpty(false)
                .map(healthy -> Map.entry(agent.agentId(), healthy)))
            .doOnNext(probe -> {
                if (!probe.getValue()) return;
                AgentStatus previous = state.get().agent(probe.getKey());
                update(s -> s.withLiveness(probe.getKey(), LivenessState.ACTIVE));
                if (previous != null && previous.liveness() != LivenessState.STARTING) {
                    log.info("[Coordinator] Agent recovered. tickId={} agentId={} from={}",
                             tickId, probe.getKey(), previous.liveness());
                }
            })
            .then();
    }

    private void reportLivenessChanges(String tickId, CoordinatorState before, CoordinatorState after) {
        after.agents().forEach((id, status) -> {
            AgentStatus previous = before.agent(id);
            if (previous != null && previous.liveness() != status.liveness()) {
                log.warn("[Coordinator] Agent liveness changed. tickId={} agentId={} from={} to={}",
                         tickId, id, previous.liveness(), status.liveness());
            }
        });
    }

    // ── outcomes ─────────────────────────────────────────────────────────────

    /**
     * Resolves a pending decision with its realised outcome. Emits {@code false} when the
     * decision is unknown or already resolved.
     */
    public Mono<Boolean> reportOutcome(String decisionId, OutcomeLabel label, double pnl) {
        return Mono.defer(() -> {
            if (label == null || !label.isResolved()) {
                return Mono.error(new ValidationException("outcome label must be SUCCESS, FAILURE or NEUTRAL"));
            }
            Optional<PendingDecision> claimed = pending.remove(decisionId);
            if (claimed.isEmpty()) {
                log.warn("[Coordinator] Outcome for unknown or resolved decision ignored. decisionId={} outcome={}",
                         decisionId, label);
                return Mono.just(false);
            }
            return resolve(claimed.get(), label, pnl).thenReturn(true);
        });
    }

    /** Labels pending decisions older than the outcome timeout NEUTRAL. Emits how many expired. */
    public Mono<Integer> expireStaleOutcomes() {
        return Mono.defer(() -> {
            Instant cutoff = clock.instant().minus(settings.outcomeTimeout());
            return Flux.fromIterable(pending.registeredBefore(cutoff))
                .concatMap(p -> pending.remove(p.decisionId())
                    .map(claimed -> {
                        log.info("[Coordinator] Outcome timed out, labelling NEUTRAL. decisionId={} registeredAt={}",
                                 claimed.decisionId(), claimed.registeredAt());
                        return resolve(claimed, OutcomeLabel.NEUTRAL, 0.0).thenReturn(1);
                    })
                    .orElse(Mono.just(0)))
                .reduce(0, Integer::sum);
        });
    }

    /** Replays parked outcome learning. Emits how many entries were learned this pass. */
    public Mono<Integer> retryDeferredLearning() {
        return Mono.defer(() -> {
            List<LearningBacklog.Parked> parked = backlog.drain();
            if (parked.isEmpty()) return Mono.just(0);
            log.info("[Coordinator] Retrying deferred learning. entries={}", parked.size());
            return Flux.fromIterable(parked)
                .concatMap(this::learn)
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue);
        });
    }

    private Mono<Void> resolve(PendingDecision claimed, OutcomeLabel label, double pnl) {
        journal.resolve(claimed.decisionId(), label);
        counters.updateAndGet(c -> c.withOutcome(label, pnl));
        log.info("[Coordinator] Outcome resolved. decisionId={} outcome={} pnl={}",
                 claimed.decisionId(), label, pnl);
        settlePhase();
        return learn(new LearningBacklog.Parked(claimed, label, pnl, 0)).then();
    }

    /**
     * Ingests the outcome, annotates the decision record, then adjusts weights. Any memory
     * failure parks the entry; emits {@code true} once weights were applied.
     */
    private Mono<Boolean> learn(LearningBacklog.Parked entry) {
        PendingDecision p = entry.pending();
        AgentEvent outcomeEvent = AgentEvent.outcome(p.decision(), entry.label(), entry.pnl());
        return outputRouter.ingest(AgentEvent.COORDINATOR_ID, outcomeEvent)
            .flatMap(result -> result.persistenceFailed()
                ? Mono.error(new DegradedDependencyException("memory-store", result.persistenceError()))
                : Mono.just(result))
            .then(Mono.defer(() -> p.recordId() == null
                ? Mono.just(false)
                : outputRouter.annotateOutcome(p.recordId(), entry.label())))
            .map(annotated -> {
                applyWeights(p, entry.label());
                return true;
            })
            .onErrorResume(e -> {
                LearningBacklog.Parked next = entry.retried();
                if (backlog.park(next)) {
                    log.warn("[Coordinator] Memory unavailable, learning parked. decisionId={} attempt={} reason={}",
                             p.decisionId(), next.attempts(), e.getMessage());
                } else {
                    log.error("[Coordinator] Learning dropped after {} attempts. decisionId={} reason={}",
                              next.attempts(), p.decisionId(), e.getMessage());
                }
                return Mono.just(false);
            });
    }

    private void applyWeights(PendingDecision p, OutcomeLabel label) {
        synchronized (weightLock) {
            for (String agentId : p.supportingAgentIds()) {
                AgentStatus current = state.get().agent(agentId);
                if (current == null) continue;
                double next = settings.weightAdjuster().adjust(current.weight(), label);
                if (next != current.weight()) {
                    update(s -> s.withWeight(agentId, next));
                    flowLogger.weightChanged(p.decisionId(), agentId, current.weight(), next, label);
                }
            }
        }
    }

    // ── mode / views ─────────────────────────────────────────────────────────

    public void updateMode(CoordinationMode mode) {
        CoordinationMode previous = state.get().mode();
        update(s -> s.withMode(mode));
        log.info("[Coordinator] Mode changed. from={} to={} threshold={} maxPosition={}",
                 previous, mode, mode.consensusThreshold(), mode.maxPositionFraction());
        if (mode.consensusThreshold() > settings.degradedConsensusCeiling()) {
            log.warn("[Coordinator] Mode threshold above degraded ceiling, degraded ticks will only defer. mode={} threshold={} ceiling={}",
                     mode, mode.consensusThreshold(), settings.degradedConsensusCeiling());
        }
    }

    public CoordinatorSnapshot snapshot() {
        CoordinatorState current = state.get();
        if (current == null) current = CoordinatorState.initial(List.of(), settings.mode());
        return new CoordinatorSnapshot(
            phase,
            current.mode(),
            current.degraded(),
            current.activeFraction(),
            current.tickCount(),
            lastTickId,
            lastTickAt,
            settings.watchlist(),
            current.agentList(),
            pending.size(),
            backlog.size(),
            counters.get(),
            store.status(),
            outputRouter.stats(),
            inputRouter.stats());
    }

    public List<CoordinationDecision> recentDecisions(int limit) {
        return journal.recent(limit);
    }

    public CoordinatorState state() {
        return state.get();
    }

    public CoordinatorPhase phase() {
        return phase;
    }

    public int pendingOutcomes() {
        return pending.size();
    }

    public int learningBacklog() {
        return backlog.size();
    }

    // ── internals ────────────────────────────────────────────────────────────

    private CoordinatorState update(UnaryOperator<CoordinatorState> change) {
        return state.updateAndGet(change);
    }

    /** Runs before the tick's result reaches the subscriber, so a caller may start the next tick at once. */
    private void finishTick() {
        tickInFlight.set(false);
        settlePhase();
    }

    /** Phase updates from a running tick; a stop that happened meanwhile is kept. */
    private void enterPhase(CoordinatorPhase next) {
        if (phase != CoordinatorPhase.STOPPED) phase = next;
    }

    private void settlePhase() {
        if (phase == CoordinatorPhase.STOPPED || tickInFlight.get()) return;
        phase = pending.isEmpty() ? CoordinatorPhase.IDLE : CoordinatorPhase.AWAITING_OUTCOME;
    }
}
