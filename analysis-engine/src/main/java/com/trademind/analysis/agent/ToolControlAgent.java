package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keeps the set of enabled tools from its {@code tools} parameter. Tools listed in
 * {@code suspend-on-reject} are suspended after a rejected decision and restored by the
 * next approved one. Never votes.
 */
public class ToolControlAgent extends AbstractTradingAgent {

    private final Set<String> configured;
    private final Set<String> suspendOnReject;
    private final Set<String> suspended = new LinkedHashSet<>();

    public ToolControlAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.configured = split(definition.param("tools", "market-data,paper-execution"));
        this.suspendOnReject = split(definition.param("suspend-on-reject", "paper-execution"));
    }

    @Override
    protected synchronized void onEvent(AgentEvent event) {
        if (event.kind() != EventKind.DECISION) return;
        Object verdict = event.attributes().get("verdict");
        if ("REJECTED".equals(verdict) && suspended.addAll(suspendOnReject)) {
            log.info("[ToolControl] Tools suspended. decisionId={} tools={}", event.refId(), suspendOnReject);
        } else if ("APPROVED".equals(verdict) && !suspended.isEmpty()) {
            suspended.clear();
            log.info("[ToolControl] Tools restored. decisionId={}", event.refId());
        }
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        return Mono.empty();
    }

    public synchronized Set<String> enabledTools() {
        Set<String> enabled = new LinkedHashSet<>(configured);
        enabled.removeAll(suspended);
        return enabled;
    }

    private static Set<String> split(String csv) {
        Set<String> out = new LinkedHashSet<>();
        Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).forEach(out::add);
        return out;
    }
}
