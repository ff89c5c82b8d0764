package com.trademind.common.agent;

import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.RankedMemory;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Agent-side view of shared memory. Implemented on top of the input and output routers so
 * agents never touch the store directly.
 */
public interface MemoryAccess {

    MemoryAccess NONE = new MemoryAccess() {
        @Override
        public Mono<List<RankedMemory>> recall(String agentId, MemoryQuery query) {
            return Mono.just(List.of());
        }

        @Override
        public Mono<Void> publish(String agentId, AgentEvent event) {
            return Mono.empty();
        }
    };

    Mono<List<RankedMemory>> recall(String agentId, MemoryQuery query);

    Mono<Void> publish(String agentId, AgentEvent event);
}
