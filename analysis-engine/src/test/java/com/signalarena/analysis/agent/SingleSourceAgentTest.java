package com.signalarena.analysis.agent;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ExchangeFlow;
import com.signalarena.common.model.ForecastMarket;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.signalarena.analysis.TestSnapshots.allBullish;
import static com.signalarena.analysis.TestSnapshots.market;
import static com.signalarena.analysis.TestSnapshots.unpriced;
import static org.junit.jupiter.api.Assertions.*;

class SingleSourceAgentTest {

    private static final double EPS = 1e-9;

    private static EventSnapshot news(NewsEvent... events) {
        return EventSnapshot.empty().withNews(List.of(events));
    }

    private static EventSnapshot onChain(OnChainMetrics metrics) {
        return EventSnapshot.empty().withOnChain(metrics);
    }

    // ── forecast market ───────────────────────────────────────────────────

    @Nested
    @DisplayName("ForecastMarketAgent")
    class ForecastMarketTests {

        @Test
        @DisplayName("BTC-$100k at 0.68 → BUY, confidence 0.60 + 2 × excess")
        void buyAboveThreshold() {
            Signal signal = new ForecastMarketAgent("FM", 0.65).evaluate(market(100), allBullish()).orElseThrow();
            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(0.60 + 2 * (0.68 - 0.65), signal.confidence(), EPS);
        }

        @Test
        @DisplayName("identical reading twice → signal only the first time")
        void dedup() {
            ForecastMarketAgent agent = new ForecastMarketAgent("FM", 0.65);
            assertTrue(agent.evaluate(market(100), allBullish()).isPresent());
            assertTrue(agent.evaluate(market(101), allBullish()).isEmpty());

            EventSnapshot moved = allBullish().withForecastMarkets(
                Map.of("btc_100k", ForecastMarket.of("btc_100k", 0.75)));
            assertTrue(agent.evaluate(market(102), moved).isPresent());
        }

        @Test
        @DisplayName("confidence capped at 0.90")
        void capped() {
            EventSnapshot extreme = EventSnapshot.empty().withForecastMarkets(
                Map.of("recession", ForecastMarket.of("recession", 0.99)));
            Signal signal = new ForecastMarketAgent("FM", 0.65).evaluate(market(100), extreme).orElseThrow();
            assertEquals(SignalAction.SELL, signal.action());
            assertEquals(0.90, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("no forecast data → no signal")
        void absent() {
            assertTrue(new ForecastMarketAgent("FM", 0.65).evaluate(market(100), EventSnapshot.empty()).isEmpty());
            assertTrue(new ForecastMarketAgent("FM", 0.65).evaluate(market(100), null).isEmpty());
        }
    }

    // ── on-chain ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("OnChainAgent")
    class OnChainTests {

        @Test
        @DisplayName("$450M inflows → BUY scaled by size, then deduplicated")
        void inflowsBuy() {
            OnChainAgent agent = new OnChainAgent("OC", OnChainAgent.DEFAULT_INFLOW_THRESHOLD_USD);
            EventSnapshot events = onChain(OnChainMetrics.ofInflows(450_000_000d, 0));

            Signal signal = agent.evaluate(market(100), events).orElseThrow();
            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(0.6 + 0.45 * 0.05, signal.confidence(), EPS);
            assertTrue(agent.evaluate(market(100), events).isEmpty());
        }

        @Test
        @DisplayName("TVL +10% → BUY 0.72, then −10% → SELL 0.75")
        void tvlSwings() {
            OnChainAgent agent = new OnChainAgent("OC", OnChainAgent.DEFAULT_INFLOW_THRESHOLD_USD);
            assertTrue(agent.evaluate(market(100), onChain(OnChainMetrics.ofInflows(0, 100e9))).isEmpty());

            Signal up = agent.evaluate(market(100), onChain(OnChainMetrics.ofInflows(0, 110e9))).orElseThrow();
            assertEquals(SignalAction.BUY, up.action());
            assertEquals(0.72, up.confidence(), EPS);

            Signal down = agent.evaluate(market(100), onChain(OnChainMetrics.ofInflows(0, 99e9))).orElseThrow();
            assertEquals(SignalAction.SELL, down.action());
            assertEquals(0.75, down.confidence(), EPS);
        }

        @Test
        @DisplayName("stablecoin supply drop overrides inflow BUY")
        void stablecoinDropWins() {
            OnChainAgent agent = new OnChainAgent("OC", OnChainAgent.DEFAULT_INFLOW_THRESHOLD_USD);
            OnChainMetrics metrics = new OnChainMetrics(500_000_000d, 0, -400_000_000d, Map.of());
            Signal signal = agent.evaluate(market(100), onChain(metrics)).orElseThrow();
            assertEquals(SignalAction.SELL, signal.action());
            assertEquals(0.73, signal.confidence(), EPS);
        }
    }

    // ── news ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("NewsAgent")
    class NewsTests {

        @Test
        @DisplayName("bullish Fed event boosted by 1.5 → BUY capped at 0.88, once")
        void fedBoost() {
            NewsAgent agent = new NewsAgent("News", NewsAgent.DEFAULT_IMPACT_THRESHOLD, NewsAgent.DEFAULT_FED_MULTIPLIER);
            Optional<Signal> first = agent.evaluate(market(100), allBullish());
            assertEquals(SignalAction.BUY, first.orElseThrow().action());
            assertEquals(0.88, first.get().confidence(), EPS);
            assertTrue(agent.evaluate(market(100), allBullish()).isEmpty());
        }

        @Test
        @DisplayName("bearish event → SELL with 0.6 + impact / 10")
        void bearish() {
            NewsAgent agent = new NewsAgent("News", 2.0, 1.5);
            Signal signal = agent.evaluate(market(100),
                news(NewsEvent.of("coindesk", "Exchange hack drains reserves", 2.5, Sentiment.BEARISH))).orElseThrow();
            assertEquals(SignalAction.SELL, signal.action());
            assertEquals(0.85, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("neutral Fed event → SELL 0.65")
        void neutralFed() {
            Signal signal = new NewsAgent("News", 2.0, 1.5).evaluate(market(100),
                news(NewsEvent.of("fed", "FOMC minutes released", 2.0, Sentiment.NEUTRAL))).orElseThrow();
            assertEquals(SignalAction.SELL, signal.action());
            assertEquals(0.65, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("below impact threshold → no signal")
        void belowThreshold() {
            assertTrue(new NewsAgent("News", 2.0, 1.5).evaluate(market(100),
                news(NewsEvent.of("coindesk", "Minor update", 1.5, Sentiment.BULLISH))).isEmpty());
        }
    }

    // ── specialists ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("FedNewsAgent / SecAgent / FlowWatcherAgent")
    class SpecialistTests {

        @Test
        @DisplayName("Fed keyword rules: cut → BUY 0.82, hike → SELL 0.82, pause → BUY 0.72")
        void fedKeywords() {
            FedNewsAgent agent = new FedNewsAgent("Fed");
            Signal cut = agent.evaluate(market(100),
                news(NewsEvent.of("fed", "Fed announces rate cut", 3.0, Sentiment.NEUTRAL))).orElseThrow();
            Signal hike = agent.evaluate(market(100),
                news(NewsEvent.of("fed", "Fed signals another hike", 3.0, Sentiment.NEUTRAL))).orElseThrow();
            Signal pause = agent.evaluate(market(100),
                news(NewsEvent.of("fed", "Fed expected to pause", 3.0, Sentiment.NEUTRAL))).orElseThrow();

            assertEquals(SignalAction.BUY, cut.action());
            assertEquals(0.82, cut.confidence(), EPS);
            assertEquals(SignalAction.SELL, hike.action());
            assertEquals(0.72, pause.confidence(), EPS);
        }

        @Test
        @DisplayName("Fed headline already handled → no signal")
        void fedDedup() {
            FedNewsAgent agent = new FedNewsAgent("Fed");
            EventSnapshot events = news(NewsEvent.of("fed", "Fed announces rate cut", 3.0, Sentiment.NEUTRAL));
            assertTrue(agent.evaluate(market(100), events).isPresent());
            assertTrue(agent.evaluate(market(100), events).isEmpty());
        }

        @Test
        @DisplayName("SEC ETF approval → BUY 0.92, rejection → SELL 0.85")
        void secEtf() {
            SecAgent agent = new SecAgent("SEC");
            Signal approval = agent.evaluate(market(100), news(new NewsEvent("sec",
                "SEC to approve spot bitcoin ETF", "", 4.0, Sentiment.NEUTRAL, List.of("etf")))).orElseThrow();
            Signal rejection = agent.evaluate(market(100), news(new NewsEvent("sec",
                "SEC rejects ETF application", "", 4.0, Sentiment.NEUTRAL, List.of("etf")))).orElseThrow();

            assertEquals(SignalAction.BUY, approval.action());
            assertEquals(0.92, approval.confidence(), EPS);
            assertEquals(SignalAction.SELL, rejection.action());
            assertEquals(0.85, rejection.confidence(), EPS);
        }

        @Test
        @DisplayName("summed exchange inflows over $200M → BUY")
        void flows() {
            OnChainMetrics metrics = new OnChainMetrics(0, 0, 0,
                Map.of("binance", new ExchangeFlow(120_000_000d, 140_000_000d)));
            Signal signal = new FlowWatcherAgent("Flows", FlowWatcherAgent.DEFAULT_FLOW_THRESHOLD_USD)
                .evaluate(market(100), onChain(metrics)).orElseThrow();
            assertEquals(SignalAction.BUY, signal.action());
            assertEquals(0.65 + 0.26 * 0.05, signal.confidence(), EPS);
        }

        @Test
        @DisplayName("exchange inflows under the threshold → no signal")
        void smallFlows() {
            OnChainMetrics metrics = new OnChainMetrics(0, 0, 0,
                Map.of("binance", new ExchangeFlow(50_000_000d, 60_000_000d)));
            assertTrue(new FlowWatcherAgent("Flows", FlowWatcherAgent.DEFAULT_FLOW_THRESHOLD_USD)
                .evaluate(market(100), onChain(metrics)).isEmpty());
        }
    }

    // ── malformed snapshots ───────────────────────────────────────────────

    @Nested
    @DisplayName("snapshot without a price")
    class MissingPriceTests {

        /** Evidence every single-source agent acts on. */
        private EventSnapshot everySourceFiring() {
            return new EventSnapshot(
                Map.of("btc_100k", ForecastMarket.of("btc_100k", 0.68)),
                new OnChainMetrics(450_000_000d, 50_000_000_000d, 0.0,
                    Map.of("binance", new ExchangeFlow(120_000_000d, 140_000_000d))),
                List.of(NewsEvent.of("fed", "Fed signals patience on policy", 3.5, Sentiment.BULLISH),
                        new NewsEvent("sec", "SEC to approve spot bitcoin ETF", "", 4.0,
                                      Sentiment.NEUTRAL, List.of("etf"))));
        }

        @Test
        @DisplayName("no agent emits, and the evidence is still acted on once a price arrives")
        void noSignalWithoutPrice() {
            List<StrategyAgent> agents = List.of(
                new ForecastMarketAgent("FM", 0.65),
                new OnChainAgent("OnChain", OnChainAgent.DEFAULT_INFLOW_THRESHOLD_USD),
                new NewsAgent("News", NewsAgent.DEFAULT_IMPACT_THRESHOLD, NewsAgent.DEFAULT_FED_MULTIPLIER),
                new FedNewsAgent("Fed"),
                new SecAgent("SEC"),
                new FlowWatcherAgent("Flows", FlowWatcherAgent.DEFAULT_FLOW_THRESHOLD_USD));

            for (StrategyAgent agent : agents) {
                assertTrue(agent.evaluate(unpriced(), everySourceFiring()).isEmpty(), agent.agentName());
                Signal signal = agent.evaluate(market(100), everySourceFiring()).orElseThrow();
                assertEquals(100.0, signal.price(), agent.agentName());
            }
        }
    }
}
