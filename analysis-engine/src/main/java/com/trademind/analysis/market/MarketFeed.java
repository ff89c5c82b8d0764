package com.trademind.analysis.market;

import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.SignalSource;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Source of quotes for the watchlist, sampled once at the start of every tick. */
public interface MarketFeed {

    Mono<Map<String, MarketQuote>> snapshot(List<String> symbols);

    /** Last quote handed out for {@code symbol}, if any. */
    Optional<MarketQuote> latest(String symbol);

    SignalSource source();
}
