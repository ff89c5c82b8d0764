package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Trading-rule validation. Votes HOLD on a symbol when:
 * <ul>
 *   <li>its move this bar exceeds {@code max-move-pct} (circuit-breaker style), or</li>
 *   <li>recently observed signals on it point in opposite directions.</li>
 * </ul>
 * Abstains when no rule fires.
 */
public class RuleSetAgent extends AbstractTradingAgent {

    private final double maxMovePct;

    public RuleSetAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.maxMovePct = definition.param("max-move-pct", 5.0);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        for (Map.Entry<String, MarketQuote> entry : new TreeMap<>(context.quotes()).entrySet()) {
            if (Math.abs(entry.getValue().changePercent()) > maxMovePct) {
                return Mono.just(signal(entry.getKey(), TradeAction.HOLD, 0.9, 0.9,
                                        Map.of("rule", "max-move", "changePct", entry.getValue().changePercent())));
            }
        }
        Map<String, Set<String>> directions = new HashMap<>();
        for (AgentEvent event : recentEvents()) {
            if (event.kind() != EventKind.SIGNAL || event.symbol() == null) continue;
            Object action = event.attributes().get("action");
            if ("BUY".equals(action) || "SELL".equals(action)) {
                directions.computeIfAbsent(event.symbol(), k -> new HashSet<>()).add((String) action);
            }
        }
        return Mono.justOrEmpty(new TreeMap<>(directions).entrySet().stream()
            .filter(e -> e.getValue().size() > 1 && context.watchlist().contains(e.getKey()))
            .findFirst()
            .map(e -> signal(e.getKey(), TradeAction.HOLD, 0.6, 0.5, Map.of("rule", "conflicting-signals"))));
    }
}
