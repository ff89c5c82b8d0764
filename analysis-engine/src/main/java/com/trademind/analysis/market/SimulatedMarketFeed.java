package com.trademind.analysis.market;

import com.trademind.common.model.MarketQuote;
import com.trademind.common.model.SignalSource;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Seeded geometric random walk per symbol. Each {@link #snapshot} advances every
 * requested symbol by one bar; the same seed replays the same price path.
 *
 * <p>Symbols priced below the penny threshold start near {@code $2}; everything else near
 * {@code $100}. Prefixes are taken from the symbol name: {@code PNY*} symbols are penny
 * stocks.
 */
public class SimulatedMarketFeed implements MarketFeed {

    private static final int HISTORY = 60;
    private static final double DRIFT = 0.0002;

    private final Clock clock;
    private final double barVolatility;
    private final long seed;
    private final Map<String, SymbolPath> paths = new ConcurrentHashMap<>();

    public SimulatedMarketFeed(Clock clock, long seed, double barVolatility) {
        this.clock = clock;
        this.seed = seed;
        this.barVolatility = barVolatility;
    }

    @Override
    public Mono<Map<String, MarketQuote>> snapshot(List<String> symbols) {
        return Mono.fromCallable(() -> {
            Map<String, MarketQuote> quotes = new LinkedHashMap<>();
            for (String symbol : symbols) {
                quotes.put(symbol, paths.computeIfAbsent(symbol, this::newPath).advance());
            }
            return quotes;
        });
    }

    @Override
    public Optional<MarketQuote> latest(String symbol) {
        SymbolPath path = paths.get(symbol);
        return path == null ? Optional.empty() : Optional.ofNullable(path.last);
    }

    @Override
    public SignalSource source() {
        return SignalSource.SIMULATED;
    }

    private SymbolPath newPath(String symbol) {
        double start = symbol.startsWith("PNY") ? 2.0 : 100.0;
        return new SymbolPath(symbol, start, new Random(seed ^ symbol.hashCode()));
    }

    private final class SymbolPath {
        private final String symbol;
        private final Random random;
        private final Deque<Double> closes = new ArrayDeque<>();
        private final long baseVolume;
        private MarketQuote last;

        SymbolPath(String symbol, double start, Random random) {
            this.symbol = symbol;
            this.random = random;
            this.baseVolume = 100_000L + random.nextInt(900_000);
            double price = start;
            for (int i = 0; i < HISTORY; i++) {
                price = step(price);
                closes.addFirst(price);
            }
        }

        synchronized MarketQuote advance() {
            double previous = closes.peekFirst();
            double price = step(previous);
            closes.addFirst(price);
            while (closes.size() > HISTORY) closes.removeLast();

            double changePercent = (price - previous) / previous * 100.0;
            double spike = random.nextDouble() < 0.1 ? 2.0 + random.nextDouble() * 2.0 : 0.7 + random.nextDouble() * 0.6;
            long volume = (long) (baseVolume * spike);
            last = new MarketQuote(symbol, price, changePercent, volume, realisedVolatility(),
                                   new ArrayList<>(closes), clock.instant());
            return last;
        }

        private double step(double price) {
            double shock = random.nextGaussian() * barVolatility;
            return Math.max(0.01, price * Math.exp(DRIFT + shock));
        }

        private double realisedVolatility() {
            List<Double> list = new ArrayList<>(closes);
            int n = Math.min(20, list.size() - 1);
            if (n < 2) return 0.0;
            double mean = 0;
            double[] returns = new double[n];
            for (int i = 0; i < n; i++) {
                returns[i] = Math.log(list.get(i) / list.get(i + 1));
                mean += returns[i];
            }
            mean /= n;
            double var = 0;
            for (double r : returns) var += (r - mean) * (r - mean);
            return Math.sqrt(var / (n - 1));
        }
    }
}
