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

/** RSI mean reversion: buys oversold, sells overbought, abstains otherwise. */
public class SignalGeneratorAgent extends AbstractTradingAgent {

    private final int period;
    private final double oversold;
    private final double overbought;

    public SignalGeneratorAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.period = (int) definition.param("rsi-period", 14);
        this.oversold = definition.param("oversold", 30);
        this.overbought = definition.param("overbought", 70);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        String bestSymbol = null;
        double bestRsi = Double.NaN;
        double bestDistance = 0;
        for (Map.Entry<String, MarketQuote> entry : new TreeMap<>(context.quotes()).entrySet()) {
            double rsi = TechnicalIndicators.rsi(entry.getValue().recentCloses(), period);
            if (Double.isNaN(rsi)) continue;
            double distance = rsi < oversold ? oversold - rsi : rsi > overbought ? rsi - overbought : 0;
            if (distance > bestDistance) {
                bestDistance = distance;
                bestSymbol = entry.getKey();
                bestRsi = rsi;
            }
        }
        if (bestSymbol == null) return Mono.empty();

        TradeAction action = bestRsi < oversold ? TradeAction.BUY : TradeAction.SELL;
        double confidence = 0.5 + Math.min(0.45, bestDistance / 60.0);
        double risk = Math.min(1.0, context.quotes().get(bestSymbol).volatility() * 20);
        return Mono.just(signal(bestSymbol, action, confidence, risk,
                                Map.of("rsi", bestRsi, "zone", TechnicalIndicators.rsiSignal(bestRsi))));
    }
}
