package com.signalarena.analysis.detector;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Optional;

/**
 * Reads aggregate capital-flow metrics. Conditions in priority order:
 * <ol>
 *   <li>exchange inflows ≥ inflow threshold → BUY</li>
 *   <li>stablecoin supply +$400M over 24h → BUY; −$300M → SELL</li>
 *   <li>DeFi TVL moved more than ±5% since the previous reading → BUY / SELL</li>
 * </ol>
 *
 * <p>Remembers the previous TVL reading, so one instance belongs to one agent.
 */
public class OnChainDetector implements SourceDetector {

    public static final double DEFAULT_INFLOW_THRESHOLD_USD   = 400_000_000d;
    static final double STABLECOIN_INCREASE_THRESHOLD_USD     = 400_000_000d;
    static final double STABLECOIN_DECREASE_THRESHOLD_USD     = -300_000_000d;
    static final double TVL_CHANGE_THRESHOLD_PCT              = 5.0;

    private final double inflowThresholdUsd;
    private Double previousTvl;

    public OnChainDetector() {
        this(DEFAULT_INFLOW_THRESHOLD_USD);
    }

    public OnChainDetector(double inflowThresholdUsd) {
        this.inflowThresholdUsd = inflowThresholdUsd;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.ON_CHAIN;
    }

    @Override
    public synchronized Optional<Detection> detect(EventSnapshot events) {
        if (events == null || !events.has(SourceCategory.ON_CHAIN)) {
            return Optional.empty();
        }
        OnChainMetrics metrics = events.onChain();
        Double priorTvl = previousTvl;
        if (metrics.totalDefiTvlUsd() > 0) {
            previousTvl = metrics.totalDefiTvlUsd();
        }

        double inflows = metrics.totalExchangeInflowsUsd();
        if (inflows >= inflowThresholdUsd) {
            return Optional.of(new Detection(SourceCategory.ON_CHAIN, SignalAction.BUY,
                "on-chain:exchange-inflows", inflows - inflowThresholdUsd,
                String.format("$%.0fM exchange inflows (threshold $%.0fM)", inflows / 1e6, inflowThresholdUsd / 1e6)));
        }

        double stablecoinChange = metrics.stablecoinSupplyChange24hUsd();
        if (stablecoinChange > STABLECOIN_INCREASE_THRESHOLD_USD) {
            return Optional.of(new Detection(SourceCategory.ON_CHAIN, SignalAction.BUY,
                "on-chain:stablecoin-supply", stablecoinChange - STABLECOIN_INCREASE_THRESHOLD_USD,
                String.format("stablecoin supply +$%.0fM in 24h", stablecoinChange / 1e6)));
        }
        if (stablecoinChange < STABLECOIN_DECREASE_THRESHOLD_USD) {
            return Optional.of(new Detection(SourceCategory.ON_CHAIN, SignalAction.SELL,
                "on-chain:stablecoin-supply", STABLECOIN_DECREASE_THRESHOLD_USD - stablecoinChange,
                String.format("stablecoin supply -$%.0fM in 24h", Math.abs(stablecoinChange) / 1e6)));
        }

        if (priorTvl != null && priorTvl > 0 && metrics.totalDefiTvlUsd() > 0) {
            double changePct = (metrics.totalDefiTvlUsd() - priorTvl) / priorTvl * 100.0;
            if (changePct > TVL_CHANGE_THRESHOLD_PCT) {
                return Optional.of(new Detection(SourceCategory.ON_CHAIN, SignalAction.BUY,
                    "on-chain:defi-tvl", changePct - TVL_CHANGE_THRESHOLD_PCT,
                    String.format("DeFi TVL %+.1f%%", changePct)));
            }
            if (changePct < -TVL_CHANGE_THRESHOLD_PCT) {
                return Optional.of(new Detection(SourceCategory.ON_CHAIN, SignalAction.SELL,
                    "on-chain:defi-tvl", -changePct - TVL_CHANGE_THRESHOLD_PCT,
                    String.format("DeFi TVL %+.1f%%", changePct)));
            }
        }
        return Optional.empty();
    }
}
