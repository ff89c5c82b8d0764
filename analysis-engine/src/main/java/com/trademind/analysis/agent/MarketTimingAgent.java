package com.trademind.analysis.agent;

import com.trademind.analysis.indicator.TechnicalIndicators;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.TreeMap;

/**
 * Trend alignment (price vs fast EMA vs slow SMA) gated on volatility: no entries while
 * realised volatility is above the configured ceiling.
 */
public class MarketTimingAgent extends AbstractTradingAgent {

    private final double maxVolatility;

    public MarketTimingAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.maxVolatility = definition.param("max-volatility", 0.02);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        for (Map.Entry<String, MarketQuote> entry : new TreeMap<>(context.quotes()).entrySet()) {
            MarketQuote q = entry.getValue();
            if (q.volatility() > maxVolatility) continue;
            double fast = TechnicalIndicators.ema(q.recentCloses(), 5);
            double slow = TechnicalIndicators.sma(q.recentCloses(), 20);
            String trend = TechnicalIndicators.trendSignal(fast, slow, q.price());
            TradeAction action = switch (trend) {
                case "UPTREND"   -> TradeAction.BUY;
                case "DOWNTREND" -> TradeAction.SELL;
                default          -> null;
            };
            if (action != null) {
                return Mono.just(signal(q.symbol(), action, 0.6, q.volatility() / maxVolatility,
                                        Map.of("trend", trend, "volatility", q.volatility())));
            }
        }
        return Mono.empty();
    }
}
