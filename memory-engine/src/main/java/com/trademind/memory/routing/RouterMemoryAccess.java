package com.trademind.memory.routing;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.RankedMemory;
import reactor.core.publisher.Mono;

import java.util.List;

/** {@link MemoryAccess} backed by the input and output routers. */
public class RouterMemoryAccess implements MemoryAccess {

    private final AgentInputRouter inputRouter;
    private final AgentOutputRouter outputRouter;

    public RouterMemoryAccess(AgentInputRouter inputRouter, AgentOutputRouter outputRouter) {
        this.inputRouter = inputRouter;
        this.outputRouter = outputRouter;
    }

    @Override
    public Mono<List<RankedMemory>> recall(String agentId, MemoryQuery query) {
        return inputRouter.retrieve(agentId, query);
    }

    @Override
    public Mono<Void> publish(String agentId, AgentEvent event) {
        return outputRouter.ingest(agentId, event).then();
    }
}
