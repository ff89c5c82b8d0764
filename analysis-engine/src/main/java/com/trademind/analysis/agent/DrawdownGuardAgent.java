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
import java.util.Map;

/** Reports the realised daily loss against {@code max-daily-loss}. */
public class DrawdownGuardAgent extends AbstractTradingAgent {

    private final PaperPortfolioBook book;
    private final Clock clock;
    private final double maxDailyLoss;

    public DrawdownGuardAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source,
                              PaperPortfolioBook book, Clock clock) {
        super(definition, memory, source);
        this.book = book;
        this.clock = clock;
        this.maxDailyLoss = definition.param("max-daily-loss", 2000.0);
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        if (context.watchlist().isEmpty()) return Mono.empty();
        RiskReport report = book.riskReport(clock.instant());
        double usage = maxDailyLoss <= 0 ? 1.0 : report.dailyLoss() / maxDailyLoss;
        if (usage >= 0.8) {
            log.warn("[DrawdownGuard] Daily loss near limit. agentId={} loss={} limit={}",
                     agentId(), report.dailyLoss(), maxDailyLoss);
        }
        return Mono.just(signal(context.watchlist().get(0), TradeAction.HOLD, clamp01(usage), usage,
                                Map.of("dailyLoss", report.dailyLoss(), "realisedPnl", book.realisedPnl()))
                            .withRiskReport(report));
    }
}
