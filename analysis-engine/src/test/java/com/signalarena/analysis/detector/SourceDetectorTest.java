package com.signalarena.analysis.detector;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.consensus.SourceVote;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ForecastMarket;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceDetectorTest {

    private static EventSnapshot markets(Map<String, ForecastMarket> markets) {
        return EventSnapshot.empty().withForecastMarkets(markets);
    }

    @Nested
    @DisplayName("ForecastMarketDetector")
    class ForecastTests {

        private final ForecastMarketDetector detector = new ForecastMarketDetector();

        @Test
        @DisplayName("unlikely Fed hike (p < 1 − T) → BUY")
        void unlikelyHikeIsBullish() {
            Detection d = detector.detect(markets(Map.of("fed_hike", ForecastMarket.of("fed_hike", 0.30))))
                                  .orElseThrow();
            assertEquals(SignalAction.BUY, d.direction());
            assertEquals(0.05, d.excess(), 1e-9);
        }

        @Test
        @DisplayName("neutral zone → abstain")
        void neutralZone() {
            SourceVote vote = detector.vote(markets(Map.of("btc_100k", ForecastMarket.of("btc_100k", 0.50))));
            assertFalse(vote.hasOpinion());
            assertEquals(SourceCategory.FORECAST_MARKET, vote.source());
        }

        @Test
        @DisplayName("BTC group is checked before the Fed-hike group")
        void groupPriority() {
            Detection d = detector.detect(markets(Map.of(
                "btc_100k", ForecastMarket.of("btc_100k", 0.70),
                "fed_hike", ForecastMarket.of("fed_hike", 0.90)))).orElseThrow();
            assertEquals(SignalAction.BUY, d.direction());
        }

        @Test
        @DisplayName("threshold must lie in (0.5, 1)")
        void invalidThreshold() {
            assertThrows(IllegalArgumentException.class, () -> new ForecastMarketDetector(0.5));
            assertThrows(IllegalArgumentException.class, () -> new ForecastMarketDetector(1.0));
        }
    }

    @Nested
    @DisplayName("OnChainDetector")
    class OnChainTests {

        @Test
        @DisplayName("inflows exactly at $400M count as BUY")
        void inclusiveThreshold() {
            OnChainDetector detector = new OnChainDetector();
            EventSnapshot events = EventSnapshot.empty().withOnChain(OnChainMetrics.ofInflows(400_000_000d, 0));
            assertEquals(SignalAction.BUY, detector.detect(events).orElseThrow().direction());
        }

        @Test
        @DisplayName("DeFi TVL change is measured against the previous round")
        void tvlChange() {
            OnChainDetector detector = new OnChainDetector();
            assertTrue(detector.detect(EventSnapshot.empty().withOnChain(OnChainMetrics.ofInflows(0, 100e9))).isEmpty());
            assertEquals(SignalAction.SELL, detector.detect(
                EventSnapshot.empty().withOnChain(OnChainMetrics.ofInflows(0, 90e9))).orElseThrow().direction());
            assertTrue(detector.detect(EventSnapshot.empty().withOnChain(OnChainMetrics.ofInflows(0, 91e9))).isEmpty());
        }

        @Test
        @DisplayName("stablecoin supply swings vote on their own")
        void stablecoins() {
            OnChainDetector detector = new OnChainDetector();
            assertEquals(SignalAction.BUY, detector.detect(EventSnapshot.empty().withOnChain(
                new OnChainMetrics(0, 0, 450_000_000d, Map.of()))).orElseThrow().direction());
            assertEquals(SignalAction.SELL, detector.detect(EventSnapshot.empty().withOnChain(
                new OnChainMetrics(0, 0, -350_000_000d, Map.of()))).orElseThrow().direction());
        }
    }

    @Nested
    @DisplayName("NewsDetector")
    class NewsTests {

        @Test
        @DisplayName("neutral SEC ETF approval → BUY, and the event is consumed")
        void secApproval() {
            NewsDetector detector = new NewsDetector(2.0, new SeenEventMemory());
            EventSnapshot events = EventSnapshot.empty().withNews(List.of(
                NewsEvent.of("sec", "SEC moves to approve ETF", 3.0, Sentiment.NEUTRAL)));

            assertEquals(SignalAction.BUY, detector.detect(events).orElseThrow().direction());
            assertTrue(detector.detect(events).isEmpty());
        }

        @Test
        @DisplayName("highest-impact event wins")
        void highestImpact() {
            NewsDetector detector = new NewsDetector();
            EventSnapshot events = EventSnapshot.empty().withNews(List.of(
                NewsEvent.of("coindesk", "Minor bullish note", 2.1, Sentiment.BULLISH),
                NewsEvent.of("fed", "Fed turns hawkish", 4.0, Sentiment.NEUTRAL)));
            assertEquals(SignalAction.SELL, detector.detect(events).orElseThrow().direction());
        }

        @Test
        @DisplayName("neutral event with no source rule → no reading")
        void neutralUnknown() {
            EventSnapshot events = EventSnapshot.empty().withNews(List.of(
                NewsEvent.of("coindesk", "Conference recap", 3.0, Sentiment.NEUTRAL)));
            assertTrue(new NewsDetector().detect(events).isEmpty());
        }
    }
}
