package com.signalarena.analysis.agent;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ExchangeFlow;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Locale;
import java.util.Optional;

/**
 * Watches per-exchange stablecoin inflows only. Summed USDC + USDT above the
 * threshold → BUY with {@code min(0.85, 0.65 + total/$1B × 0.05)}.
 */
public class FlowWatcherAgent implements StrategyAgent {

    public static final double DEFAULT_FLOW_THRESHOLD_USD = 200_000_000d;
    static final double MAX_CONFIDENCE = 0.85;

    private final String name;
    private final double flowThresholdUsd;
    private final SeenEventMemory seenFlows = new SeenEventMemory();

    public FlowWatcherAgent(String name, double flowThresholdUsd) {
        this.name = name;
        this.flowThresholdUsd = flowThresholdUsd;
    }

    @Override
    public String agentName() { return name; }

    @Override
    public Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice() || events == null || !events.has(SourceCategory.ON_CHAIN)) {
            return Optional.empty();
        }
        double usdc = 0;
        double usdt = 0;
        for (ExchangeFlow flow : events.onChain().exchangeFlows().values()) {
            usdc += flow.usdc();
            usdt += flow.usdt();
        }
        double total = usdc + usdt;
        if (total <= flowThresholdUsd) {
            return Optional.empty();
        }
        if (!seenFlows.markSeen(String.format(Locale.ROOT, "exchange-flows:%.0f", total))) {
            return Optional.empty();
        }

        double confidence = Math.min(MAX_CONFIDENCE, 0.65 + (total / 1e9) * 0.05);
        String reason = String.format("$%.0fM stablecoin exchange inflows (USDC: $%.0fM, USDT: $%.0fM)",
            total / 1e6, usdc / 1e6, usdt / 1e6);
        return Optional.of(Signal.of(market, SignalAction.BUY, confidence, Signal.DEFAULT_SIZE, reason, name));
    }
}
