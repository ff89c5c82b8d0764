package com.trademind.analysis.agent;

import com.trademind.analysis.market.MarketFeed;
import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.OutcomeListener;
import com.trademind.common.model.SignalSource;

import java.time.Clock;

/** Equities venue: every symbol that is not a prediction-market contract. */
public class IbkrExecutionAgent extends PaperExecutionAgent {

    public IbkrExecutionAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source,
                              MarketFeed feed, PaperPortfolioBook book, OutcomeListener outcomes, Clock clock) {
        super(definition, memory, source, feed, book, outcomes, clock);
    }

    @Override
    protected String venue() {
        return "IBKR";
    }

    @Override
    public boolean handles(String symbol) {
        return !KalshiExecutionAgent.isContract(symbol);
    }
}
