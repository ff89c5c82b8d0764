package com.trademind.analysis.agent;

import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MemoryQuery;
import com.trademind.common.model.MemoryRecord;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.QueryType;
import com.trademind.common.model.RankedMemory;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Learns from labelled decision history. For each watched symbol it recalls past
 * decisions and outcomes, measures the success rate per direction and recommends the
 * direction that has worked, once enough labelled samples exist.
 */
public class MemoryLearnerAgent extends AbstractTradingAgent {

    private final int minSamples;
    private final double minSuccessRate;
    private final int maxSymbols;

    public MemoryLearnerAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source) {
        super(definition, memory, source);
        this.minSamples = (int) definition.param("min-samples", 3);
        this.minSuccessRate = definition.param("min-success-rate", 0.6);
        this.maxSymbols = (int) definition.param("max-symbols", 3);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        return Flux.fromIterable(context.watchlist())
            .take(maxSymbols)
            .concatMap(symbol -> memory.recall(agentId(), query(symbol))
                .flatMap(memories -> Mono.justOrEmpty(recommend(symbol, memories))))
            .next();
    }

    private static MemoryQuery query(String symbol) {
        return MemoryQuery.of("decision outcome " + symbol, QueryType.COORDINATION_DECISIONS, symbol, 10)
                          .includingFailures();
    }

    private Signal recommend(String symbol, List<RankedMemory> memories) {
        Map<TradeAction, int[]> tally = tally(memories);
        TradeAction best = null;
        double bestRate = 0;
        int bestSamples = 0;
        for (Map.Entry<TradeAction, int[]> entry : tally.entrySet()) {
            int samples = entry.getValue()[0] + entry.getValue()[1];
            if (samples < minSamples) continue;
            double rate = entry.getValue()[0] / (double) samples;
            if (rate > bestRate) {
                best = entry.getKey();
                bestRate = rate;
                bestSamples = samples;
            }
        }
        if (best == null || bestRate < minSuccessRate) return null;
        return signal(symbol, best, bestRate * 0.8, 1.0 - bestRate,
                      Map.of("successRate", bestRate, "samples", bestSamples));
    }

    /** Success and failure counts per direction; index 0 successes, 1 failures. */
    static Map<TradeAction, int[]> tally(List<RankedMemory> memories) {
        Map<TradeAction, int[]> tally = new EnumMap<>(TradeAction.class);
        for (RankedMemory memory : memories) {
            MemoryRecord record = memory.record();
            if (record.eventKind() == EventKind.SIGNAL) continue;
            OutcomeLabel label = record.outcomeLabel();
            if (label != OutcomeLabel.SUCCESS && label != OutcomeLabel.FAILURE) continue;
            TradeAction action = directionOf(record.summary());
            if (action == null) continue;
            tally.computeIfAbsent(action, a -> new int[2])[label == OutcomeLabel.SUCCESS ? 0 : 1]++;
        }
        return tally;
    }

    static TradeAction directionOf(String summary) {
        String text = " " + summary.toUpperCase(Locale.ROOT) + " ";
        boolean buy = text.contains(" BUY ");
        boolean sell = text.contains(" SELL ");
        if (buy == sell) return null;
        return buy ? TradeAction.BUY : TradeAction.SELL;
    }
}
