package com.trademind.orchestrator;

import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.RiskReport;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Test agent whose signal, health and event handling are scripted per test. */
public final class ScriptedAgent implements TradingAgent {

    private final String agentId;
    private final AgentKind kind;
    private volatile Function<TickContext, Mono<Signal>> script;
    private volatile Function<AgentEvent, Mono<Void>> onEvent = event -> Mono.empty();
    private final AtomicBoolean healthy = new AtomicBoolean(true);
    private final AtomicInteger polls = new AtomicInteger();
    private final List<AgentEvent> received = new CopyOnWriteArrayList<>();

    public ScriptedAgent(String agentId, AgentKind kind, Function<TickContext, Mono<Signal>> script) {
        this.agentId = agentId;
        this.kind = kind;
        this.script = script;
    }

    public static ScriptedAgent voting(String agentId, AgentKind kind, String symbol, TradeAction action,
                                       double confidence) {
        return new ScriptedAgent(agentId, kind,
            ctx -> Mono.just(Signal.of(agentId, symbol, action, confidence, 0.2, null, null)));
    }

    public static ScriptedAgent risk(String agentId, RiskReport report) {
        return new ScriptedAgent(agentId, AgentKind.PORTFOLIO_RISK,
            ctx -> Mono.just(Signal.of(agentId, "AAPL", TradeAction.HOLD, 0.5, 0.1, null, null)
                               .withRiskReport(report)));
    }

    public static ScriptedAgent silent(String agentId, AgentKind kind) {
        return new ScriptedAgent(agentId, kind, ctx -> Mono.empty());
    }

    public void script(Function<TickContext, Mono<Signal>> next) {
        this.script = next;
    }

    /** Replaces how delivered events are acknowledged; they are still recorded. */
    public ScriptedAgent onEvent(Function<AgentEvent, Mono<Void>> next) {
        this.onEvent = next;
        return this;
    }

    public void healthy(boolean value) {
        healthy.set(value);
    }

    public int polls() {
        return polls.get();
    }

    public List<AgentEvent> received() {
        return List.copyOf(received);
    }

    @Override
    public String agentId() {
        return agentId;
    }

    @Override
    public AgentKind kind() {
        return kind;
    }

    @Override
    public Mono<Signal> produceSignal(TickContext context) {
        polls.incrementAndGet();
        return script.apply(context);
    }

    @Override
    public Mono<Void> consumeEvent(AgentEvent event) {
        received.add(event);
        return onEvent.apply(event);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(healthy.get());
    }

    @Override
    public double significance() {
        return kind.defaultSignificance();
    }

    @Override
    public Set<AgentCategory> interests() {
        return kind.defaultInterests();
    }
}
