package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wash-sale watch: after a realised loss on a symbol, votes HOLD on it until the
 * configured window has passed.
 */
public class TaxEstimatorAgent extends AbstractTradingAgent {

    private final Duration washWindow;
    private final Map<String, Instant> lossSales = new ConcurrentHashMap<>();

    public TaxEstimatorAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.washWindow = Duration.ofMinutes((long) definition.param("wash-window-minutes", 60));
    }

    @Override
    protected void onEvent(AgentEvent event) {
        if (event.kind() != EventKind.OUTCOME || event.symbol() == null) return;
        Object pnl = event.attributes().get("pnl");
        if (pnl instanceof Number n && n.doubleValue() < 0) {
            lossSales.put(event.symbol(), event.timestamp());
        }
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        for (String symbol : context.watchlist()) {
            Instant soldAt = lossSales.get(symbol);
            if (soldAt != null && soldAt.plus(washWindow).isAfter(context.startedAt())) {
                return Mono.just(signal(symbol, TradeAction.HOLD, 0.5, 0.3,
                                        Map.of("washSaleUntil", soldAt.plus(washWindow).toString())));
            }
        }
        return Mono.empty();
    }
}
