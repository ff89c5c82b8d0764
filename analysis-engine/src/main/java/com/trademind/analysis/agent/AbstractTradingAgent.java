package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shared plumbing for the reference agents: identity from the {@link AgentDefinition},
 * a bounded inbox of received events, and helpers to build signals.
 *
 * <p>Subclasses implement {@link #evaluate(TickContext)} and may override
 * {@link #onEvent(AgentEvent)}.
 */
public abstract class AbstractTradingAgent implements TradingAgent {

    private static final int INBOX_CAPACITY = 50;

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final AgentDefinition definition;
    protected final MemoryAccess memory;
    private final SignalSource source;
    private final Deque<AgentEvent> inbox = new ArrayDeque<>();

    protected AbstractTradingAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        this.definition = definition;
        this.memory = memory == null ? MemoryAccess.NONE : memory;
        this.source = source == null ? SignalSource.DERIVED : source;
    }

    @Override
    public String agentId() {
        return definition.agentId();
    }

    @Override
    public AgentKind kind() {
        return definition.kind();
    }

    @Override
    public double significance() {
        return definition.effectiveSignificance();
    }

    @Override
    public Set<AgentCategory> interests() {
        return definition.effectiveInterests();
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }

    @Override
    public final Mono<Signal> produceSignal(TickContext context) {
        return Mono.defer(() -> context.isCancelled() ? Mono.<Signal>empty() : evaluate(context));
    }

    @Override
    public Mono<Void> consumeEvent(AgentEvent event) {
        return Mono.fromRunnable(() -> {
            synchronized (inbox) {
                inbox.addFirst(event);
                while (inbox.size() > INBOX_CAPACITY) inbox.removeLast();
            }
            onEvent(event);
        });
    }

    /** Empty Mono to abstain. */
    protected abstract Mono<Signal> evaluate(TickContext context);

    protected void onEvent(AgentEvent event) {
    }

    /** Received events, newest first. */
    protected List<AgentEvent> recentEvents() {
        synchronized (inbox) {
            return List.copyOf(inbox);
        }
    }

    protected Signal signal(String symbol, TradeAction action, double confidence, double risk,
                            Map<String, Object> payload) {
        return Signal.of(agentId(), symbol, action, clamp01(confidence), clamp01(risk), payload, source);
    }

    protected static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
