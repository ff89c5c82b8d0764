package com.trademind.analysis.agent;

import com.trademind.analysis.market.MarketFeed;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches the feed itself. Tracks a per-symbol volume baseline and emits a low-confidence
 * directional signal when volume spikes on a move. Reports unhealthy when the feed has
 * stopped serving watched symbols.
 */
public class MarketDataAgent extends AbstractTradingAgent {

    private static final double BASELINE_ALPHA = 0.2;

    private final MarketFeed feed;
    private final double spikeMultiple;
    private final Map<String, Double> volumeBaseline = new ConcurrentHashMap<>();
    private volatile boolean lastSnapshotComplete = true;

    public MarketDataAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source, MarketFeed feed) {
        super(definition, memory, source);
        this.feed = feed;
        this.spikeMultiple = definition.param("spike-multiple", 2.0);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(lastSnapshotComplete);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        long missing = context.watchlist().stream().filter(s -> context.quote(s).isEmpty()).count();
        lastSnapshotComplete = missing == 0;
        if (missing > 0) {
            log.warn("[MarketData] Quotes missing. source={} missing={} watched={}",
                     feed.source(), missing, context.watchlist().size());
        }

        Signal spike = null;
        for (Map.Entry<String, MarketQuote> entry : new TreeMap<>(context.quotes()).entrySet()) {
            MarketQuote q = entry.getValue();
            Double baseline = volumeBaseline.get(q.symbol());
            volumeBaseline.put(q.symbol(), baseline == null
                ? q.volume()
                : baseline + BASELINE_ALPHA * (q.volume() - baseline));
            if (spike == null && baseline != null && baseline > 0
                && q.volume() > spikeMultiple * baseline && Math.abs(q.changePercent()) > 0.3) {
                spike = signal(q.symbol(), q.changePercent() > 0 ? TradeAction.BUY : TradeAction.SELL,
                               0.35, 0.5, Map.of("volume", q.volume(), "baseline", baseline));
            }
        }
        return Mono.justOrEmpty(spike);
    }
}
