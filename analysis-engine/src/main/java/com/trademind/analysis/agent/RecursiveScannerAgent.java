package com.trademind.analysis.agent;

import com.trademind.analysis.indicator.TechnicalIndicators;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Multi-timeframe momentum scan. Starting from the longest window it descends to shorter
 * ones only while momentum keeps the same sign; a symbol qualifies when every window
 * agrees.
 */
public class RecursiveScannerAgent extends AbstractTradingAgent {

    private static final int[] WINDOWS = {20, 10, 5};

    public RecursiveScannerAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        String best = null;
        double bestStrength = 0;
        for (Map.Entry<String, MarketQuote> entry : new TreeMap<>(context.quotes()).entrySet()) {
            List<Double> closes = entry.getValue().recentCloses();
            double first = TechnicalIndicators.momentum(closes, WINDOWS[0]);
            if (Double.isNaN(first) || first == 0.0) continue;
            int depth = agreeingDepth(closes, 0, Math.signum(first));
            if (depth == WINDOWS.length && Math.abs(first) > Math.abs(bestStrength)) {
                best = entry.getKey();
                bestStrength = first;
            }
        }
        if (best == null) return Mono.empty();

        TradeAction action = bestStrength > 0 ? TradeAction.BUY : TradeAction.SELL;
        double confidence = 0.45 + Math.min(0.4, Math.abs(bestStrength) / 10.0);
        return Mono.just(signal(best, action, confidence, 0.4,
                                Map.of("momentum20", bestStrength, "windows", WINDOWS.length)));
    }

    /** Number of consecutive windows, from {@code index} on, whose momentum has sign {@code sign}. */
    static int agreeingDepth(List<Double> closes, int index, double sign) {
        if (index >= WINDOWS.length) return 0;
        double m = TechnicalIndicators.momentum(closes, WINDOWS[index]);
        if (Double.isNaN(m) || Math.signum(m) != sign) return 0;
        return 1 + agreeingDepth(closes, index + 1, sign);
    }
}
