package com.trademind.analysis.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    /** Newest first: {@code start + step * (n - 1)} down to {@code start}. */
    static List<Double> series(double start, double step, int n) {
        List<Double> closes = new ArrayList<>();
        for (int i = n - 1; i >= 0; i--) closes.add(start + step * i);
        return closes;
    }

    @Nested
    @DisplayName("rsi()")
    class Rsi {

        @Test
        @DisplayName("insufficient data → NaN")
        void shortSeries() {
            assertTrue(Double.isNaN(TechnicalIndicators.rsi(series(100, 1, 10), 14)));
        }

        @Test
        @DisplayName("only gains → 100")
        void onlyGains() {
            assertEquals(100.0, TechnicalIndicators.rsi(series(100, 1, 30), 14), 1e-9);
        }

        @Test
        @DisplayName("flat series → neutral 50")
        void flatSeries() {
            assertEquals(50.0, TechnicalIndicators.rsi(series(100, 0, 30), 14), 1e-9);
        }

        @Test
        @DisplayName("only losses → 0 and OVERSOLD")
        void onlyLosses() {
            double rsi = TechnicalIndicators.rsi(series(100, -1, 30), 14);
            assertEquals(0.0, rsi, 1e-9);
            assertEquals("OVERSOLD", TechnicalIndicators.rsiSignal(rsi));
        }
    }

    @Nested
    @DisplayName("averages and momentum")
    class Averages {

        @Test
        void smaUsesNewestCloses() {
            assertEquals(2.0, TechnicalIndicators.sma(List.of(1.0, 2.0, 3.0, 100.0), 3), 1e-9);
        }

        @Test
        void momentumIsPercentChangeOverLookback() {
            assertEquals(10.0, TechnicalIndicators.momentum(List.of(110.0, 105.0, 100.0), 2), 1e-9);
            assertTrue(Double.isNaN(TechnicalIndicators.momentum(List.of(110.0), 2)));
        }

        @Test
        void stdDevOfConstantSeriesIsZero() {
            assertEquals(0.0, TechnicalIndicators.stdDev(List.of(5.0, 5.0, 5.0), 3), 1e-12);
        }

        @Test
        void trendClassification() {
            assertEquals("UPTREND", TechnicalIndicators.trendSignal(101, 100, 102));
            assertEquals("DOWNTREND", TechnicalIndicators.trendSignal(99, 100, 98));
            assertEquals("SIDEWAYS", TechnicalIndicators.trendSignal(101, 100, 100.5));
            assertEquals("INSUFFICIENT_DATA", TechnicalIndicators.trendSignal(Double.NaN, 100, 100));
        }
    }
}
