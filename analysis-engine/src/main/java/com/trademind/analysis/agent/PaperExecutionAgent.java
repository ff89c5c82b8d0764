package com.trademind.analysis.agent;

import com.trademind.analysis.market.MarketFeed;
import com.trademind.analysis.portfolio.PaperPortfolioBook;
import com.trademind.common.agent.MemoryAccess;
import com.trademind.common.agent.OutcomeListener;
import com.trademind.common.model.AgentEvent;
import com.trademind.common.model.EventKind;
import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.OutcomeLabel;
import com.trademind.common.model.Signal;
import com.trademind.common.model.SignalSource;
import com.trademind.common.model.TickContext;
import com.trademind.common.model.TradeAction;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Paper-trading execution venue.
 *
 * <p>Fills approved decisions for the symbols it {@linkplain #handles handles} at the
 * latest quote, holds each position for {@code hold-ticks} ticks and then closes it,
 * reporting the realised P&amp;L to the {@link OutcomeListener}. Execution agents never
 * vote: {@link #evaluate} always abstains and only advances the hold counters.
 */
public abstract class PaperExecutionAgent extends AbstractTradingAgent {

    private final MarketFeed feed;
    private final PaperPortfolioBook book;
    private final OutcomeListener outcomes;
    private final Clock clock;
    private final int holdTicks;
    private final Map<String, Integer> ticksHeld = new ConcurrentHashMap<>();

    protected PaperExecutionAgent(AgentDefinition definition, MemoryAccess memory, SignalSource source,
                                  MarketFeed feed, PaperPortfolioBook book,
                                  OutcomeListener outcomes, Clock clock) {
        super(definition, memory, source);
        this.feed = feed;
        this.book = book;
        this.outcomes = outcomes;
        this.clock = clock;
        this.holdTicks = Math.max(1, (int) definition.param("hold-ticks", 3));
    }

    /** Venue name recorded on the positions this agent opens. */
    protected abstract String venue();

    /** Whether this venue trades {@code symbol}. */
    public abstract boolean handles(String symbol);

    @Override
    protected void onEvent(AgentEvent event) {
        if (event.kind() != EventKind.DECISION || !"APPROVED".equals(event.attributes().get("verdict"))) return;
        if (event.symbol() == null || !handles(event.symbol())) return;

        TradeAction action = TradeAction.valueOf(String.valueOf(event.attributes().get("action")));
        double size = ((Number) event.attributes().getOrDefault("positionSize", 0.0)).doubleValue();
        MarketQuote quote = feed.latest(event.symbol()).orElse(null);
        if (quote == null || action == TradeAction.HOLD || size <= 0) {
            log.warn("[{}] Cannot fill decision. decisionId={} symbol={} quote={}",
                     venue(), event.refId(), event.symbol(), quote != null);
            return;
        }
        book.open(event.refId(), event.symbol(), venue(), action.direction() * size, quote.price(), clock.instant());
        ticksHeld.put(event.refId(), 0);
        log.info("[{}] Paper fill. decisionId={} action={} symbol={} size={} price={}",
                 venue(), event.refId(), action, event.symbol(), size, quote.price());
    }

    @Override
    protected Mono<Signal> evaluate(TickContext context) {
        List<PaperPortfolioBook.Position> due = new ArrayList<>();
        for (PaperPortfolioBook.Position position : book.openPositions(venue())) {
            int held = ticksHeld.merge(position.decisionId(), 1, Integer::sum);
            if (held >= holdTicks) due.add(position);
        }
        return Flux.fromIterable(due)
            .concatMap(position -> closeAndReport(position, context))
            .then(Mono.empty());
    }

    private Mono<Void> closeAndReport(PaperPortfolioBook.Position position, TickContext context) {
        double price = context.quote(position.symbol()).map(MarketQuote::price)
            .or(() -> feed.latest(position.symbol()).map(MarketQuote::price))
            .orElse(position.entryPrice());
        return Mono.justOrEmpty(book.close(position.decisionId(), price, clock.instant()))
            .flatMap(trade -> {
                ticksHeld.remove(position.decisionId());
                log.info("[{}] Position closed. decisionId={} symbol={} pnl={}",
                         venue(), position.decisionId(), position.symbol(), trade.pnl());
                return outcomes.onOutcome(position.decisionId(), OutcomeLabel.fromPnl(trade.pnl()), trade.pnl());
            })
            .onErrorResume(e -> {
                log.error("[{}] Outcome report failed. decisionId={} error={}",
                          venue(), position.decisionId(), e.getMessage());
                return Mono.empty();
            });
    }
}
