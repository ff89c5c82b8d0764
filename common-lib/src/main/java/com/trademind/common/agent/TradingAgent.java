package com.trademind.common.agent;

import com.trademind.common.model.AgentCategory;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.AgentKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Uniform capability every agent role implements. The coordinator only ever talks to
 * agents through this contract.
 *
 * <ul>
 *   <li>{@link #produceSignal} is called once per tick; an empty Mono means the agent
 *       abstains for this tick.</li>
 *   <li>{@link #consumeEvent} receives fan-out notifications and, for execution roles,
 *       approved decisions.</li>
 * </ul>
 */
public interface TradingAgent {

    String agentId();

    AgentKind kind();

    default AgentCategory category() {
        return kind().category();
    }

    Mono<Signal> produceSignal(TickContext context);

    Mono<Void> consumeEvent(AgentEvent event);

    /** Emits {@code true} when the agent can be polled. Errors count as unhealthy. */
    Mono<Boolean> healthCheck();

    /** Importance contribution of this agent's events, in {@code [0, 1]}. */
    double significance();

    /** Event categories this agent wants delivered through fan-out. */
    Set<AgentCategory> interests();
}
