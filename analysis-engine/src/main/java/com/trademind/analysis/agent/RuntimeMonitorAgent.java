package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;

/** Counts coordination and execution traffic. Never votes. */
public class RuntimeMonitorAgent extends AbstractTradingAgent {

    private final Map<EventKind, Long> seen = new EnumMap<>(EventKind.class);
    private long degradedDecisions;

    public RuntimeMonitorAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
    }

    @Override
    protected synchronized void onEvent(AgentEvent event) {
        seen.merge(event.kind(), 1L, Long::sum);
        if (event.kind() == EventKind.DECISION && Boolean.TRUE.equals(event.attributes().get("degraded"))) {
            degradedDecisions++;
            log.warn("[RuntimeMonitor] Degraded decision observed. decisionId={} total={}",
                     event.refId(), degradedDecisions);
        }
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        return Mono.empty();
    }

    public synchronized Map<EventKind, Long> eventCounts() {
        return Map.copyOf(seen);
    }

    public synchronized long degradedDecisions() {
        return degradedDecisions;
    }
}
