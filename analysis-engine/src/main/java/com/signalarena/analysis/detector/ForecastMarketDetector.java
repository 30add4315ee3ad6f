package com.signalarena.analysis.detector;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ForecastMarket;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads forecast-market probabilities.
 *
 * <p>Market groups are checked in priority order; within a group the first listed
 * key that is present and outside the neutral zone wins:
 * <pre>
 *   BTC price  (btc_100k, btc_above_100k, bitcoin_100k) : p &gt; T → BUY,  p &lt; 1−T → SELL
 *   Fed hike   (fed_hike, fed_rate_hike, rate_hike)     : p &gt; T → SELL, p &lt; 1−T → BUY
 *   Recession  (recession, us_recession, recession_2025): p &gt; T → SELL, p &lt; 1−T → BUY
 * </pre>
 * The detection identity carries the probability rounded to two decimals, so a
 * market that moves re-arms agents that deduplicate on it. Stateless.
 */
public class ForecastMarketDetector implements SourceDetector {

    public static final double DEFAULT_THRESHOLD = 0.65;

    static final List<MarketGroup> GROUPS = List.of(
        new MarketGroup("BTC price", SignalAction.BUY,  List.of("btc_100k", "btc_above_100k", "bitcoin_100k")),
        new MarketGroup("Fed hike",  SignalAction.SELL, List.of("fed_hike", "fed_rate_hike", "rate_hike")),
        new MarketGroup("Recession", SignalAction.SELL, List.of("recession", "us_recession", "recession_2025"))
    );

    private final double threshold;

    public ForecastMarketDetector() {
        this(DEFAULT_THRESHOLD);
    }

    public ForecastMarketDetector(double threshold) {
        if (threshold <= 0.5 || threshold >= 1.0) {
            throw new IllegalArgumentException("threshold must be in (0.5, 1.0) but was " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.FORECAST_MARKET;
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public Optional<Detection> detect(EventSnapshot events) {
        if (events == null || !events.has(SourceCategory.FORECAST_MARKET)) {
            return Optional.empty();
        }
        for (MarketGroup group : GROUPS) {
            for (String key : group.keys()) {
                Optional<ForecastMarket> market = events.forecastMarket(key);
                if (market.isEmpty()) continue;

                double p = market.get().yesProbability();
                if (p > threshold) {
                    return Optional.of(detection(group, group.directionWhenLikely(), market.get(), p - threshold));
                }
                if (p < 1.0 - threshold) {
                    return Optional.of(detection(group, group.directionWhenLikely().opposite(), market.get(),
                                                 (1.0 - threshold) - p));
                }
            }
        }
        return Optional.empty();
    }

    private Detection detection(MarketGroup group, SignalAction direction, ForecastMarket market, double excess) {
        String detail = String.format("%s market %s at %.0f%% YES (threshold %.0f%%)",
            group.label(), market.key(), market.yesProbability() * 100, threshold * 100);
        String identity = String.format(Locale.ROOT, "forecast-market:%s@%.2f", market.key(), market.yesProbability());
        return new Detection(SourceCategory.FORECAST_MARKET, direction, identity, excess, detail);
    }

    record MarketGroup(String label, SignalAction directionWhenLikely, List<String> keys) {}
}
