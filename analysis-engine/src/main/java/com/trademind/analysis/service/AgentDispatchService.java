package com.trademind.analysis.service;

import com.trademind.common.agent.TradingAgent;
import com.trademind.common.exception.AgentException;
import com.trademind.common.model.Signal;
import com.trademind.common.model.TickContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Polls agents in parallel for one tick. Every agent gets its own deadline; a slow,
 * failing or misbehaving agent yields a typed {@link AgentResponse} instead of failing
 * the tick.
 */
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);

    public Mono<List<AgentResponse>> dispatch(List<TradingAgent> agents, TickContext context, Duration perAgentTimeout) {
        log.info("[Dispatch] Polling agents. tickId={} agents={} timeoutMs={}",
                 context.tickId(), agents.size(), perAgentTimeout.toMillis());
        return Flux.fromIterable(agents)
            .flatMap(agent -> poll(agent, context, perAgentTimeout))
            .collectList();
    }

    private Mono<AgentResponse> poll(TradingAgent agent, TickContext context, Duration timeout) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.defer(() -> agent.produceSignal(context))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(signal -> AgentResponse.signalled(agent.agentId(), checkOwner(agent, signal), elapsed(start)))
                .switchIfEmpty(Mono.fromSupplier(() -> AgentResponse.abstained(agent.agentId(), elapsed(start))))
                .doOnNext(r -> log.debug("[Dispatch] Agent done. tickId={} agentId={} status={} latencyMs={}",
                                         context.tickId(), agent.agentId(), r.status(), r.latencyMs()))
                .onErrorResume(TimeoutException.class, e -> {
                    log.warn("[Dispatch] Agent timed out. tickId={} agentId={} timeoutMs={}",
                             context.tickId(), agent.agentId(), timeout.toMillis());
                    return Mono.just(AgentResponse.timedOut(agent.agentId(), elapsed(start)));
                })
                .onErrorResume(e -> {
                    log.error("[Dispatch] Agent failed. tickId={} agentId={} error={}",
                              context.tickId(), agent.agentId(), e.getMessage(), e);
                    return Mono.just(AgentResponse.failed(agent.agentId(), String.valueOf(e.getMessage()),
                                                          elapsed(start)));
                });
        });
    }

    private static Signal checkOwner(TradingAgent agent, Signal signal) {
        if (!agent.agentId().equals(signal.agentId())) {
            throw new AgentException(agent.agentId(),
                "signal attributed to " + signal.agentId() + " instead of " + agent.agentId());
        }
        return signal;
    }

    private static long elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
