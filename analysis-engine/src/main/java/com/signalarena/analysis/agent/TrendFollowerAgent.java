package com.signalarena.analysis.agent;

import com.signalarena.analysis.indicator.PriceWindow;
import com.signalarena.analysis.indicator.TechnicalIndicators;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Moving-average crossover.
 *
 * <pre>
 *   fast SMA &gt; slow SMA → BUY,  confidence = min(0.5 + (fast − slow) / slow, 0.95)
 *   fast SMA &lt; slow SMA → SELL, confidence = min(0.5 + (slow − fast) / slow, 0.95)
 * </pre>
 * Silent until {@code slowPeriod} prices have been observed, and when the averages are equal.
 */
public class TrendFollowerAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(TrendFollowerAgent.class);

    static final double BASE_CONFIDENCE = 0.5;
    static final double MAX_CONFIDENCE  = 0.95;

    private final String name;
    private final int fastPeriod;
    private final int slowPeriod;
    private final PriceWindow window;

    public TrendFollowerAgent(String name, int fastPeriod, int slowPeriod) {
        if (fastPeriod < 1 || slowPeriod <= fastPeriod) {
            throw new IllegalArgumentException(
                "require 1 <= fastPeriod < slowPeriod but got fast=" + fastPeriod + " slow=" + slowPeriod);
        }
        this.name = name;
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.window = new PriceWindow(slowPeriod);
    }

    @Override
    public String agentName() { return name; }

    @Override
    public synchronized Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice()) {
            log.debug("[{}] No usable price, skipping", name);
            return Optional.empty();
        }
        window.append(market.price());
        if (!window.hasAtLeast(slowPeriod)) {
            return Optional.empty();
        }

        List<Double> prices = window.snapshot();
        double fast = TechnicalIndicators.sma(prices, fastPeriod);
        double slow = TechnicalIndicators.sma(prices, slowPeriod);

        SignalAction action;
        if (fast > slow)      action = SignalAction.BUY;
        else if (fast < slow) action = SignalAction.SELL;
        else                  return Optional.empty();

        double confidence = Math.min(BASE_CONFIDENCE + Math.abs(fast - slow) / slow, MAX_CONFIDENCE);
        String reason = String.format("MA crossover: fast(%.2f), slow(%.2f)", fast, slow);

        return Optional.of(Signal.of(market, action, confidence, Signal.DEFAULT_SIZE * confidence, reason, name));
    }
}
