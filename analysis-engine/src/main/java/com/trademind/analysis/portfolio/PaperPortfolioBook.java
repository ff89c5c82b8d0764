package com.trademind.analysis.portfolio;

import com.trademind.common.model.RiskReport;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory paper trading book shared by execution agents (which fill it) and risk
 * agents (which report from it).
 *
 * <p>Positions are keyed by the decision that opened them. Sizes are signed fractions of
 * {@code capital}; realised losses accumulate per UTC day.
 */
public class PaperPortfolioBook {

    public record Position(String decisionId, String symbol, String venue, double signedSize,
                           double entryPrice, Instant openedAt) {}

    public record ClosedTrade(Position position, double exitPrice, double pnl, Instant closedAt) {}

    private final double capital;
    private final Map<String, Position> open = new LinkedHashMap<>();
    private LocalDate lossDay;
    private double dailyLoss;
    private double realisedPnl;

    public PaperPortfolioBook(double capital) {
        this.capital = capital;
    }

    public synchronized Position open(String decisionId, String symbol, String venue,
                                      double signedSize, double price, Instant at) {
        Position position = new Position(decisionId, symbol, venue, signedSize, price, at);
        open.put(decisionId, position);
        return position;
    }

    public synchronized Optional<ClosedTrade> close(String decisionId, double price, Instant at) {
        Position position = open.remove(decisionId);
        if (position == null) return Optional.empty();
        double pnl = position.signedSize() * capital * (price - position.entryPrice()) / position.entryPrice();
        realisedPnl += pnl;
        rollDay(at);
        if (pnl < 0) dailyLoss += -pnl;
        return Optional.of(new ClosedTrade(position, price, pnl, at));
    }

    public synchronized List<Position> openPositions(String venue) {
        return open.values().stream().filter(p -> p.venue().equals(venue)).toList();
    }

    public synchronized int openPositionCount() {
        return open.size();
    }

    public synchronized Map<String, Double> exposure() {
        Map<String, Double> exposure = new HashMap<>();
        for (Position p : open.values()) {
            exposure.merge(p.symbol(), p.signedSize(), Double::sum);
        }
        return exposure;
    }

    /** Realised loss in currency units for the UTC day of {@code now}. */
    public synchronized double dailyLoss(Instant now) {
        rollDay(now);
        return dailyLoss;
    }

    public synchronized double realisedPnl() {
        return realisedPnl;
    }

    public double capital() {
        return capital;
    }

    public synchronized RiskReport riskReport(Instant now) {
        return new RiskReport(open.size(), dailyLoss(now), exposure());
    }

    private void rollDay(Instant at) {
        LocalDate day = at.atZone(ZoneOffset.UTC).toLocalDate();
        if (!day.equals(lossDay)) {
            lossDay = day;
            dailyLoss = 0.0;
        }
    }
}
