package com.signalarena.common.performance;

import com.signalarena.common.model.TradeOutcome;

import java.util.List;

/**
 * Pure statistics over an agent's trade-outcome history.
 *
 * <pre>
 *   winRate       = count(pnl &gt; 0) / count(all)
 *   sharpeRatio   = mean(pnl) / (stddev(pnl) + 1e-6) × √annualizationFactor
 *   cumulativePnl = Σ pnl
 * </pre>
 *
 * <p>{@code stddev} is the population standard deviation. Every method returns
 * {@code 0.0} for an empty history. No logging, no state.
 */
public final class PerformanceCalculator {

    public static final double DEFAULT_ANNUALIZATION_FACTOR = 252.0;
    static final double STDDEV_EPSILON = 1e-6;

    private PerformanceCalculator() {}

    public static double winRate(List<TradeOutcome> history) {
        if (history == null || history.isEmpty()) return 0.0;
        long wins = history.stream().filter(TradeOutcome::isWin).count();
        return (double) wins / history.size();
    }

    public static double cumulativePnl(List<TradeOutcome> history) {
        if (history == null || history.isEmpty()) return 0.0;
        return history.stream().mapToDouble(TradeOutcome::pnl).sum();
    }

    public static double sharpeRatio(List<TradeOutcome> history) {
        return sharpeRatio(history, DEFAULT_ANNUALIZATION_FACTOR);
    }

    public static double sharpeRatio(List<TradeOutcome> history, double annualizationFactor) {
        if (history == null || history.isEmpty()) return 0.0;
        double mean = history.stream().mapToDouble(TradeOutcome::pnl).average().orElse(0.0);
        double variance = history.stream()
            .mapToDouble(o -> (o.pnl() - mean) * (o.pnl() - mean))
            .average()
            .orElse(0.0);
        return mean / (Math.sqrt(variance) + STDDEV_EPSILON) * Math.sqrt(annualizationFactor);
    }
}
