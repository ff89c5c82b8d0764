package com.trademind.analysis.agent;

import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.model.RiskReport;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.Map;

/**
 * Reports open positions and per-symbol exposure from the paper book. The signal's risk
 * score is the largest exposure relative to {@code symbol-cap}.
 */
public class PortfolioRiskAgent extends AbstractTradingAgent {

    private final PaperPortfolioBook book;
    private final Clock clock;
    private final double symbolCap;

    public PortfolioRiskAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source,
                              PaperPortfolioBook book, Clock clock) {
        super(definition, memory, source);
        this.book = book;
        this.clock = clock;
        this.symbolCap = definition.param("symbol-cap", 0.10);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        RiskReport report = book.riskReport(clock.instant());
        String symbol = report.symbolExposure().entrySet().stream()
            .max(Comparator.comparingDouble((Map.Entry<String, Double> e) -> Math.abs(e.getValue()))
                           .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
            .map(Map.Entry::getKey)
            .orElse(context.watchlist().isEmpty() ? null : context.watchlist().get(0));
        if (symbol == null) return Mono.empty();

        double risk = symbolCap <= 0 ? 1.0 : Math.abs(report.exposureFor(symbol)) / symbolCap;
        return Mono.just(signal(symbol, TradeAction.HOLD, 0.5, risk,
                                Map.of("openPositions", report.openPositions(),
                                       "exposure", report.exposureFor(symbol)))
                            .withRiskReport(report));
    }
}
