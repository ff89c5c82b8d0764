package com.trademind.analysis.portfolio;

import com.trademind.common.model.RiskReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PaperPortfolioBookTest {

    private static final Instant NOON = Instant.parse("2026-03-02T12:00:00Z");

    @Test
    void longPositionGainsWhenPriceRises() {
        PaperPortfolioBook book = new PaperPortfolioBook(100_000);
        book.open("d1", "AAPL", "IBKR", 0.05, 100.0, NOON);

        PaperPortfolioBook.ClosedTrade trade = book.close("d1", 110.0, NOON.plusSeconds(60)).orElseThrow();

        assertEquals(500.0, trade.pnl(), 1e-6);
        assertEquals(0, book.openPositionCount());
        assertEquals(0.0, book.dailyLoss(NOON), 1e-9);
    }

    @Test
    void shortLossAccumulatesIntoDailyLossAndResetsNextDay() {
        PaperPortfolioBook book = new PaperPortfolioBook(100_000);
        book.open("d1", "AAPL", "IBKR", -0.02, 100.0, NOON);

        double pnl = book.close("d1", 105.0, NOON).orElseThrow().pnl();

        assertEquals(-100.0, pnl, 1e-6);
        assertEquals(100.0, book.dailyLoss(NOON.plusSeconds(3600)), 1e-6);
        assertEquals(0.0, book.dailyLoss(NOON.plus(Duration.ofDays(1))), 1e-9);
    }

    @Test
    void closingUnknownDecisionIsEmpty() {
        assertTrue(new PaperPortfolioBook(1_000).close("missing", 1.0, NOON).isEmpty());
    }

    @Test
    void riskReportAggregatesExposurePerSymbol() {
        PaperPortfolioBook book = new PaperPortfolioBook(100_000);
        book.open("d1", "AAPL", "IBKR", 0.03, 100.0, NOON);
        book.open("d2", "AAPL", "IBKR", 0.02, 101.0, NOON);
        book.open("d3", "KXRAIN", "KALSHI", -0.04, 0.5, NOON);

        RiskReport report = book.riskReport(NOON);

        assertEquals(3, report.openPositions());
        assertEquals(0.05, report.exposureFor("AAPL"), 1e-9);
        assertEquals(-0.04, report.exposureFor("KXRAIN"), 1e-9);
        assertEquals(1, book.openPositions("KALSHI").size());
    }
}
