package com.trademind.memory.routing;

import com.trademind.common.agent.AgentDirectory;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Minimal agent recording what it is sent. */
class StubAgent implements TradingAgent {

    final List<AgentEvent> received = new CopyOnWriteArrayList<>();
    final AtomicInteger attempts = new AtomicInteger();
    private final String agentId;
    private final AgentKind kind;
    private final Set<AgentCategory> interests;
    private final Function<Integer, Mono<Void>> behaviour;

    StubAgent(String agentId, AgentKind kind, Set<AgentCategory> interests) {
        this(agentId, kind, interests, attempt -> Mono.empty());
    }

    StubAgent(String agentId, AgentKind kind, Set<AgentCategory> interests,
              Function<Integer, Mono<Void>> behaviour) {
        this.agentId = agentId;
        this.kind = kind;
        this.interests = interests;
        this.behaviour = behaviour;
    }

    @Override public String agentId() { return agentId; }
    @Override public AgentKind kind() { return kind; }
    @Override public Mono<Signal> produceSignal(TickContext context) { return Mono.empty(); }
    @Override public Mono<Boolean> healthCheck() { return Mono.just(true); }
    @Override public double significance() { return kind.defaultSignificance(); }
    @Override public Set<AgentCategory> interests() { return interests; }

    @Override
    public Mono<Void> consumeEvent(AgentEvent event) {
        return Mono.defer(() -> {
            int attempt = attempts.incrementAndGet();
            return behaviour.apply(attempt).doOnSuccess(v -> received.add(event));
        });
    }

    static AgentDirectory directoryOf(TradingAgent... agents) {
        List<TradingAgent> all = List.of(agents);
        return new AgentDirectory() {
            @Override public List<TradingAgent> all() { return all; }
            @Override public Optional<TradingAgent> find(String id) {
                return all.stream().filter(a -> a.agentId().equals(id)).findFirst();
            }
        };
    }
}
