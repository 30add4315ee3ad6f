package com.signalarena.analysis.agent;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Single-source agent trading capital flows.
 *
 * <ol>
 *   <li>Exchange inflows ≥ threshold → BUY, {@code min(0.85, 0.60 + inflows/$1B × 0.05)}</li>
 *   <li>else stablecoin supply +$500M → BUY 0.70</li>
 *   <li>DeFi TVL +5% since last round → confirms BUY (+0.10, max 0.90) or BUY 0.72;
 *       TVL −5% → SELL 0.75</li>
 *   <li>Stablecoin supply −$300M → SELL 0.73 (overrides the above)</li>
 * </ol>
 *
 * <p>A metric set identical to one already acted on is ignored.
 */
public class OnChainAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(OnChainAgent.class);

    public static final double DEFAULT_INFLOW_THRESHOLD_USD = 400_000_000d;
    static final double TVL_CHANGE_THRESHOLD_PCT   = 5.0;
    static final double STABLECOIN_INCREASE_USD    = 500_000_000d;
    static final double STABLECOIN_DECREASE_USD    = -300_000_000d;
    static final double INFLOW_MAX_CONFIDENCE      = 0.85;
    static final double MAX_CONFIDENCE             = 0.90;

    private final String name;
    private final double inflowThresholdUsd;
    private final SeenEventMemory seenMetrics;
    private Double previousTvl;

    public OnChainAgent(String name, double inflowThresholdUsd) {
        this(name, inflowThresholdUsd, new SeenEventMemory());
    }

    public OnChainAgent(String name, double inflowThresholdUsd, SeenEventMemory seenMetrics) {
        this.name = name;
        this.inflowThresholdUsd = inflowThresholdUsd;
        this.seenMetrics = seenMetrics;
    }

    @Override
    public String agentName() { return name; }

    @Override
    public synchronized Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice() || events == null || !events.has(SourceCategory.ON_CHAIN)) {
            return Optional.empty();
        }
        OnChainMetrics metrics = events.onChain();
        double inflows = metrics.totalExchangeInflowsUsd();
        double tvl = metrics.totalDefiTvlUsd();
        double stablecoinChange = metrics.stablecoinSupplyChange24hUsd();

        SignalAction action = SignalAction.HOLD;
        double confidence = 0.0;
        String reason = "";

        if (inflows >= inflowThresholdUsd) {
            action = SignalAction.BUY;
            confidence = Math.min(INFLOW_MAX_CONFIDENCE, 0.6 + (inflows / 1e9) * 0.05);
            reason = String.format("$%.0fM stablecoin inflows to exchanges. Threshold: $%.0fM",
                inflows / 1e6, inflowThresholdUsd / 1e6);
        } else if (stablecoinChange > STABLECOIN_INCREASE_USD) {
            action = SignalAction.BUY;
            confidence = 0.70;
            reason = String.format("$%.0fM stablecoin supply increase", stablecoinChange / 1e6);
        }

        if (previousTvl != null && previousTvl > 0 && tvl > 0) {
            double changePct = (tvl - previousTvl) / previousTvl * 100.0;
            if (changePct > TVL_CHANGE_THRESHOLD_PCT) {
                if (action == SignalAction.BUY) {
                    confidence = Math.min(MAX_CONFIDENCE, confidence + 0.10);
                    reason += String.format(" | DeFi TVL +%.1f%% (risk-on confirmation)", changePct);
                } else {
                    action = SignalAction.BUY;
                    confidence = 0.72;
                    reason = String.format("DeFi TVL surging +%.1f%% ($%.1fB). Risk-on", changePct, tvl / 1e9);
                }
            } else if (changePct < -TVL_CHANGE_THRESHOLD_PCT) {
                action = SignalAction.SELL;
                confidence = 0.75;
                reason = String.format("DeFi TVL declining %.1f%% ($%.1fB). Capital flight", changePct, tvl / 1e9);
            }
        }

        if (stablecoinChange < STABLECOIN_DECREASE_USD) {
            action = SignalAction.SELL;
            confidence = 0.73;
            reason = String.format("$%.0fM stablecoin supply decrease. Capital exiting",
                Math.abs(stablecoinChange) / 1e6);
        }

        previousTvl = tvl > 0 ? tvl : previousTvl;

        if (!action.isActionable()) {
            return Optional.empty();
        }
        String identity = String.format(Locale.ROOT, "on-chain:%.0f:%.0f:%.0f", inflows, stablecoinChange, tvl);
        if (!seenMetrics.markSeen(identity)) {
            log.debug("[{}] Metrics already acted on. identity={}", name, identity);
            return Optional.empty();
        }
        return Optional.of(Signal.of(market, action, confidence, Signal.DEFAULT_SIZE, reason, name));
    }
}
