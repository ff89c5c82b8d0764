package com.trademind.common.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Read-only view of one coordination tick handed to every agent: the tick id, its
 * deadline, the watchlist and the quotes fetched at tick start. The cancellation flag is
 * raised when the tick overruns its deadline; long-running agents should check it.
 */
public record TickContext(
    String tickId,
    Instant startedAt,
    Instant deadline,
    List<String> watchlist,
    Map<String, MarketQuote> quotes,
    AtomicBoolean cancelled
) {
    public TickContext {
        watchlist = watchlist == null ? List.of() : List.copyOf(watchlist);
        quotes = quotes == null ? Map.of() : Map.copyOf(quotes);
        cancelled = cancelled == null ? new AtomicBoolean(false) : cancelled;
    }

    public static TickContext of(String tickId, Instant startedAt, Duration deadline,
                                 List<String> watchlist, Map<String, MarketQuote> quotes) {
        return new TickContext(tickId, startedAt, startedAt.plus(deadline), watchlist, quotes,
                               new AtomicBoolean(false));
    }

    public Optional<MarketQuote> quote(String symbol) {
        return Optional.ofNullable(quotes.get(symbol));
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
