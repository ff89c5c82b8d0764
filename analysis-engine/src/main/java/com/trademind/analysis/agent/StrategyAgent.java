package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.QueryType;
import com.trademind.common.model.RankedMemory;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Momentum strategy over the strongest mover of the tick, tempered by how past decisions
 * on the same symbol turned out.
 */
public class StrategyAgent extends AbstractTradingAgent {

    private final double entryChangePct;

    public StrategyAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.entryChangePct = definition.param("entry-change-pct", 0.5);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        MarketQuote mover = context.quotes().values().stream()
            .sorted(Comparator.comparing(MarketQuote::symbol))
            .max(Comparator.comparingDouble(q -> Math.abs(q.changePercent())))
            .orElse(null);
        if (mover == null) return Mono.empty();

        double change = mover.changePercent();
        TradeAction action = change > entryChangePct ? TradeAction.BUY
                           : change < -entryChangePct ? TradeAction.SELL
                           : TradeAction.HOLD;
        double base = 0.5 + Math.min(0.4, Math.abs(change) / 5.0);

        MemoryQuery query = MemoryQuery.of("strategy " + action + " " + mover.symbol(),
                                           QueryType.STRATEGY_PERFORMANCE, mover.symbol(), 5)
                                       .includingFailures();
        return memory.recall(agentId(), query)
            .map(memories -> {
                double confidence = base * historyFactor(memories);
                return signal(mover.symbol(), action, confidence, Math.min(1.0, mover.volatility() * 20),
                              Map.of("changePct", change, "memoriesConsulted", memories.size()));
            });
    }

    /** 0.8 after only failures, 1.2 after only successes, 1.0 without labelled history. */
    static double historyFactor(List<RankedMemory> memories) {
        long success = memories.stream().filter(m -> m.record().outcomeLabel() == OutcomeLabel.SUCCESS).count();
        long failure = memories.stream().filter(m -> m.record().outcomeLabel() == OutcomeLabel.FAILURE).count();
        if (success + failure == 0) return 1.0;
        return 0.8 + 0.4 * success / (double) (success + failure);
    }
}
