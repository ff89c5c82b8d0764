package com.trademind.analysis.agent;

import com.trademind.analysis.market.MarketFeed;
import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.OutcomeListener;
import com.trademind.common.model.SignalSource;

import java.time.Clock;

/** Prediction-market venue. Contract tickers start with {@code KX}. */
public class KalshiExecutionAgent extends PaperExecutionAgent {

    static final String CONTRACT_PREFIX = "KX";

    public KalshiExecutionAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source,
                                MarketFeed feed, PaperPortfolioBook book, OutcomeListener outcomes, Clock clock) {
        super(definition, memory, source, feed, book, outcomes, clock);
    }

    static boolean isContract(String symbol) {
        return symbol != null && symbol.startsWith(CONTRACT_PREFIX);
    }

    @Override
    protected String venue() {
        return "KALSHI";
    }

    @Override
    public boolean handles(String symbol) {
        return isContract(symbol);
    }
}
