package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;

/** Flags sharp moves in low-priced symbols. Always high risk. */
public class PennyStockScannerAgent extends AbstractTradingAgent {

    private final double maxPrice;
    private final double minChangePct;

    public PennyStockScannerAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.maxPrice = definition.param("max-price", 5.0);
        this.minChangePct = definition.param("min-change-pct", 1.0);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        return Mono.justOrEmpty(context.quotes().values().stream()
            .filter(q -> q.price() < maxPrice)
            .filter(q -> Math.abs(q.changePercent()) >= minChangePct)
            .sorted(Comparator.comparing(MarketQuote::symbol))
            .max(Comparator.comparingDouble(q -> Math.abs(q.changePercent())))
            .map(q -> signal(q.symbol(),
                             q.changePercent() > 0 ? TradeAction.BUY : TradeAction.SELL,
                             0.4 + Math.min(0.4, Math.abs(q.changePercent()) / 20.0),
                             0.7,
                             Map.of("price", q.price(), "changePct", q.changePercent(), "volume", q.volume()))));
    }
}
