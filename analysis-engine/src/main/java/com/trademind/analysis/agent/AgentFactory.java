package com.trademind.analysis.agent;

import com.trademind.analysis.market.MarketFeed;
import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.OutcomeListener;
import com.trademind.common.agent.TradingAgent;
import com.trademind.common.model.SignalSource;

import java.time.Clock;
import java.util.Objects;

/** Builds the reference implementation for each {@link com.trademind.common.model.AgentKind}. */
public class AgentFactory {

    private final MemoryAccess memory;
    private final MarketFeed feed;
    private final PaperPortfolioBook book;
    private final OutcomeListener outcomes;
    private final Clock clock;

    public AgentFactory(MemoryAccess memory, MarketFeed feed, PaperPortfolioBook book,
                        OutcomeListener outcomes, Clock clock) {
        this.memory = Objects.requireNonNull(memory, "memory");
        this.feed = Objects.requireNonNull(feed, "feed");
        this.book = Objects.requireNonNull(book, "book");
        this.outcomes = Objects.requireNonNull(outcomes, "outcomes");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TradingAgent create(AgentDefinition def) {
        SignalSource source = feed.source();
        return switch (def.kind()) {
            case STRATEGY            -> new StrategyAgent(def, memory, source);
            case SIGNAL_GENERATOR    -> new SignalGeneratorAgent(def, memory, source);
            case PENNY_STOCK_SCANNER -> new PennyStockScannerAgent(def, memory, source);
            case RECURSIVE_SCANNER   -> new RecursiveScannerAgent(def, memory, source);
            case MARKET_TIMING       -> new MarketTimingAgent(def, memory, source);
            case RULE_SET            -> new RuleSetAgent(def, memory, source);
            case TAX_ESTIMATOR       -> new TaxEstimatorAgent(def, memory, source);
            case PORTFOLIO_RISK      -> new PortfolioRiskAgent(def, memory, source, book, clock);
            case DRAWDOWN_GUARD      -> new DrawdownGuardAgent(def, memory, source, book, clock);
            case IBKR_EXECUTION      -> new IbkrExecutionAgent(def, memory, source, feed, book, outcomes, clock);
            case KALSHI_EXECUTION    -> new KalshiExecutionAgent(def, memory, source, feed, book, outcomes, clock);
            case MEMORY_LEARNER      -> new MemoryLearnerAgent(def, memory, source);
            case MARKET_DATA         -> new MarketDataAgent(def, memory, source, feed);
            case RUNTIME_MONITOR     -> new RuntimeMonitorAgent(def, memory, source);
            case TOOL_CONTROL        -> new ToolControlAgent(def, memory, source);
        };
    }
}
