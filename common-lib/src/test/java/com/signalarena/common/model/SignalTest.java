package com.signalarena.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalTest {

    private final MarketSnapshot market = MarketSnapshot.of("BTCUSDT", 101.5, 1.0, Instant.EPOCH);

    @Test
    @DisplayName("of() stamps symbol, price and timestamp from the snapshot")
    void stampsFromMarket() {
        Signal signal = Signal.of(market, SignalAction.SELL, 0.7, 50.0, null, "Agent");
        assertEquals("BTCUSDT", signal.symbol());
        assertEquals(101.5, signal.price());
        assertEquals(Instant.EPOCH, signal.timestamp());
        assertEquals("", signal.reason());
        assertTrue(signal.isActionable());
    }

    @Test
    @DisplayName("confidence outside [0,1] and negative size are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class,
            () -> Signal.of(market, SignalAction.BUY, 1.01, 1.0, "", "Agent"));
        assertThrows(IllegalArgumentException.class,
            () -> Signal.of(market, SignalAction.BUY, 0.5, -1.0, "", "Agent"));
    }

    @Test
    @DisplayName("a snapshot without a usable price cannot be stamped onto a signal")
    void rejectsUnpricedMarket() {
        MarketSnapshot noPrice = new MarketSnapshot("BTCUSDT", null, 1.0, Instant.EPOCH, null, null);
        MarketSnapshot zeroPrice = MarketSnapshot.of("BTCUSDT", 0.0, 1.0, Instant.EPOCH);
        assertThrows(IllegalArgumentException.class,
            () -> Signal.of(noPrice, SignalAction.BUY, 0.8, 1.0, "", "Agent"));
        assertThrows(IllegalArgumentException.class,
            () -> Signal.of(zeroPrice, SignalAction.BUY, 0.8, 1.0, "", "Agent"));
    }

    @Test
    @DisplayName("HOLD is never actionable")
    void holdNotActionable() {
        assertFalse(Signal.of(market, SignalAction.HOLD, 0.5, 0.0, "", "Agent").isActionable());
        assertEquals(SignalAction.HOLD, SignalAction.fromString("maybe"));
    }

    @Test
    @DisplayName("news identity is source plus first 50 title characters")
    void newsIdentity() {
        String title = "x".repeat(80);
        NewsEvent event = NewsEvent.of("fed", title, 3.0, Sentiment.BULLISH);
        assertEquals("fed_" + "x".repeat(50), event.identity());
    }

    @Test
    @DisplayName("absent event categories are reported as missing, not empty")
    void eventSnapshotAbsence() {
        EventSnapshot events = EventSnapshot.empty().withNews(List.of());
        assertTrue(events.has(SourceCategory.NEWS));
        assertFalse(events.has(SourceCategory.ON_CHAIN));
        assertTrue(events.forecastMarket("btc_100k").isEmpty());
    }
}
