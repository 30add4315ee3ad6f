package com.signalarena.orchestrator.simulation;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ExchangeFlow;
import com.signalarena.common.model.ForecastMarket;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.RoundSnapshot;
import com.signalarena.common.model.Sentiment;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded stand-in for the data-collection layer.
 *
 * <p>Price follows {@code 100 + 0.001 × round + N(0,1)}. Evidence rotates through a
 * fixed set of scenarios so every agent family gets something to react to:
 * <ol>
 *   <li>all three sources bullish</li>
 *   <li>forecast market and capital flows disagree, no news</li>
 *   <li>no evidence at all</li>
 *   <li>SEC ETF approval with stablecoin mint</li>
 *   <li>hawkish Fed with recession odds rising</li>
 * </ol>
 * Headlines carry the round number so news dedup does not silence later cycles.
 */
public class SyntheticMarketFeed {

    static final double BASE_PRICE = 100.0;
    static final double DRIFT_PER_ROUND = 0.001;

    private final String symbol;
    private final Random random;
    private final Instant start;

    public SyntheticMarketFeed(String symbol, long seed) {
        this(symbol, new Random(seed), Instant.parse("2024-01-01T00:00:00Z"));
    }

    SyntheticMarketFeed(String symbol, Random random, Instant start) {
        this.symbol = symbol;
        this.random = random;
        this.start = start;
    }

    public Flux<RoundSnapshot> snapshots(int rounds) {
        return Flux.range(1, rounds).map(this::snapshot);
    }

    public RoundSnapshot snapshot(int round) {
        double price = BASE_PRICE + DRIFT_PER_ROUND * round + random.nextGaussian();
        MarketSnapshot market = MarketSnapshot.of(symbol, price, 1_000_000 + random.nextInt(500_000),
                                                  start.plus(Duration.ofMinutes(round)));
        return new RoundSnapshot(market, events(round));
    }

    EventSnapshot events(int round) {
        return switch (round % 5) {
            case 1 -> new EventSnapshot(
                Map.of("btc_100k", ForecastMarket.of("btc_100k", 0.68)),
                OnChainMetrics.ofInflows(450_000_000d, 50_000_000_000d),
                List.of(NewsEvent.of("fed", "Fed signals support for markets #" + round, 3.5, Sentiment.BULLISH)));
            case 2 -> new EventSnapshot(
                Map.of("fed_hike", ForecastMarket.of("fed_hike", 0.78)),
                OnChainMetrics.ofInflows(600_000_000d, 50_000_000_000d),
                List.of());
            case 3 -> EventSnapshot.empty();
            case 4 -> new EventSnapshot(
                null,
                new OnChainMetrics(150_000_000d, 50_000_000_000d, 650_000_000d,
                    Map.of("binance", new ExchangeFlow(120_000_000d, 140_000_000d))),
                List.of(new NewsEvent("sec", "SEC will approve spot bitcoin ETF filing #" + round, "",
                    4.0, Sentiment.BULLISH, List.of("etf", "approval"))));
            default -> new EventSnapshot(
                Map.of("recession", ForecastMarket.of("recession", 0.72)),
                null,
                List.of(NewsEvent.of("fed", "Fed hawkish, another rate hike on the table #" + round,
                    2.5, Sentiment.NEUTRAL)));
        };
    }
}
