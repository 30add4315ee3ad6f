package com.signalarena.analysis.agent;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.signalarena.analysis.TestSnapshots.allBullish;
import static com.signalarena.analysis.TestSnapshots.forecastVersusFlows;
import static com.signalarena.analysis.TestSnapshots.market;
import static com.signalarena.analysis.TestSnapshots.unpriced;
import static org.junit.jupiter.api.Assertions.*;

class HybridAgentTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("all three sources bullish → BUY at 0.91 with every vote in the reason")
    void unanimousSources() {
        Signal signal = HybridAgent.majority("Hybrid").evaluate(market(100), allBullish()).orElseThrow();

        assertEquals(SignalAction.BUY, signal.action());
        assertEquals(0.91, signal.confidence(), EPS);
        assertEquals("Hybrid", signal.agentName());
        assertTrue(signal.reason().startsWith("3/3 sources confirm BUY"));
        assertTrue(signal.reason().contains("Forecast market: BUY"));
        assertTrue(signal.reason().contains("On-chain: BUY"));
        assertTrue(signal.reason().contains("News: BUY"));
    }

    @Test
    @DisplayName("Fed-hike market SELL against $600M inflows BUY, no news → conflict, no signal")
    void conflictingSources() {
        assertTrue(HybridAgent.majority("Hybrid").evaluate(market(100), forecastVersusFlows()).isEmpty());
    }

    @Test
    @DisplayName("strict mode emits only with all three sources agreeing")
    void strictMode() {
        HybridAgent strict = HybridAgent.strict("HybridStrict");
        assertEquals(3, strict.confirmationThreshold());

        EventSnapshot twoSources = allBullish().withNews(List.of());
        assertTrue(strict.evaluate(market(100), twoSources).isEmpty());
        assertEquals(0.91, strict.evaluate(market(100), allBullish()).orElseThrow().confidence(), EPS);
    }

    @Test
    @DisplayName("two agreeing sources are enough in majority mode")
    void twoOfThree() {
        EventSnapshot twoSources = allBullish().withNews(null);
        Signal signal = HybridAgent.majority("Hybrid").evaluate(market(100), twoSources).orElseThrow();
        assertEquals(0.84, signal.confidence(), EPS);
        assertTrue(signal.reason().contains("News: no opinion"));
    }

    @Test
    @DisplayName("no event snapshot → no signal")
    void noEvents() {
        assertTrue(HybridAgent.majority("Hybrid").evaluate(market(100), null).isEmpty());
        assertTrue(HybridAgent.majority("Hybrid").evaluate(market(100), EventSnapshot.empty()).isEmpty());
    }

    @Test
    @DisplayName("snapshot without a price → no signal even when every source agrees")
    void missingPrice() {
        HybridAgent agent = HybridAgent.majority("Hybrid");
        assertTrue(agent.evaluate(unpriced(), allBullish()).isEmpty());
        assertTrue(agent.evaluate(market(100), allBullish()).isPresent());
    }
}
