package com.trademind.analysis.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input prices are expected newest-first (index 0 = most recent close).
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI with Wilder's smoothing.
     * @param prices  closing prices, newest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;

        List<Double> oldest = oldestFirst(prices);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return avgGain == 0 ? 50.0 : 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── moving averages ──────────────────────────────────────────────────────

    /** @return SMA of the newest {@code period} closes, or NaN if insufficient data */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        return sum / period;
    }

    /** @return most recent EMA value, or NaN if insufficient data */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        List<Double> oldest = oldestFirst(prices);
        double k = 2.0 / (period + 1);
        double ema = oldest.get(0);
        for (int i = 1; i < oldest.size(); i++) {
            ema = oldest.get(i) * k + ema * (1 - k);
        }
        return ema;
    }

    // ── momentum / volatility ────────────────────────────────────────────────

    /** Percent change between the newest close and the close {@code lookback} bars earlier. */
    public static double momentum(List<Double> prices, int lookback) {
        if (prices == null || prices.size() <= lookback || prices.get(lookback) == 0.0) return Double.NaN;
        return (prices.get(0) - prices.get(lookback)) / prices.get(lookback) * 100.0;
    }

    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    // ── signal helpers ───────────────────────────────────────────────────────

    public static String rsiSignal(double rsi) {
        if (Double.isNaN(rsi)) return "INSUFFICIENT_DATA";
        if (rsi < 30) return "OVERSOLD";
        if (rsi > 70) return "OVERBOUGHT";
        return "NEUTRAL";
    }

    public static String trendSignal(double fast, double slow, double currentPrice) {
        if (Double.isNaN(fast) || Double.isNaN(slow)) return "INSUFFICIENT_DATA";
        if (currentPrice > fast && fast > slow) return "UPTREND";
        if (currentPrice < fast && fast < slow) return "DOWNTREND";
        return "SIDEWAYS";
    }

    private static List<Double> oldestFirst(List<Double> newestFirst) {
        List<Double> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }
}
