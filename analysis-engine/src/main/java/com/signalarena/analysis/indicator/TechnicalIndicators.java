package com.signalarena.analysis.indicator;

import java.util.List;

/**
 * Pure calculation utilities over a price window.
 * Input prices are expected oldest-first (last index = most recent observation).
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── Simple Moving Average ────────────────────────────────────────────────

    /**
     * @param prices  observed prices, oldest-first
     * @param period  number of most recent observations to average
     * @return SMA value, or NaN if insufficient data
     */
    public static double sma(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) sum += prices.get(i);
        return sum / period;
    }

    // ── Volatility (population standard deviation) ───────────────────────────

    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || period <= 0 || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    // ── Bands ────────────────────────────────────────────────────────────────

    /** Bollinger-style band around the SMA: {@code mean ± k·σ}. */
    public static Band band(List<Double> prices, int period, double k) {
        double mean = sma(prices, period);
        double sigma = stdDev(prices, period);
        if (Double.isNaN(mean) || Double.isNaN(sigma)) return null;
        return new Band(mean - k * sigma, mean, mean + k * sigma);
    }

    public record Band(double lower, double mean, double upper) {}
}
