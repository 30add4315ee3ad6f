package com.signalarena.orchestrator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalarena.common.model.BattleRound;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.ExchangeFlow;
import com.signalarena.common.model.ForecastMarket;
import com.signalarena.common.model.OnChainMetrics;
import com.signalarena.common.model.RoundSnapshot;
import com.signalarena.common.model.SelectionMode;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.SourceCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    private final ObjectMapper mapper = new OrchestratorConfig().objectMapper();

    @Test
    @DisplayName("camel-case category names are still accepted; missing categories stay absent")
    void readsSnapshot() throws Exception {
        String json = """
            {
              "market": {"symbol": "BTCUSDT", "price": 101.5, "volume": 10, "timestamp": "2024-01-01T00:00:00Z"},
              "events": {
                "forecastMarkets": {
                  "btc_100k": {"key": "btc_100k", "title": "BTC above $100k", "yesProbability": 0.68, "source": "polymarket"}
                },
                "news": [
                  {"source": "fed", "title": "Fed signals cut", "impactScore": 3.5, "sentiment": "bullish",
                   "matchedKeywords": ["rate cut"]}
                ]
              }
            }
            """;

        RoundSnapshot snapshot = mapper.readValue(json, RoundSnapshot.class);

        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), snapshot.market().timestamp());
        assertTrue(snapshot.market().hasPrice());
        assertNull(snapshot.market().bid());
        assertTrue(snapshot.events().has(SourceCategory.FORECAST_MARKET));
        assertFalse(snapshot.events().has(SourceCategory.ON_CHAIN));
        assertEquals(0.68, snapshot.events().forecastMarket("btc_100k").orElseThrow().yesProbability());
        assertEquals(Sentiment.BULLISH, snapshot.events().news().get(0).sentiment());
    }

    @Test
    @DisplayName("collector payload keyed by source category maps onto a round snapshot")
    void readsCategoryKeyedSnapshot() throws Exception {
        String json = """
            {
              "market": {"symbol": "BTCUSDT", "price": 101.5, "volume": 10, "timestamp": "2024-01-01T00:00:00Z"},
              "events": {
                "forecast-market": {
                  "fed_hike": {"key": "fed_hike", "title": "Fed hike in March", "yesProbability": 0.78, "source": "kalshi"}
                },
                "on-chain": {
                  "totalExchangeInflowsUsd": 600000000,
                  "totalDefiTvlUsd": 50000000000,
                  "stablecoinSupplyChange24hUsd": 0,
                  "exchangeFlows": {"binance": {"usdc": 120000000, "usdt": 140000000}}
                }
              }
            }
            """;

        RoundSnapshot snapshot = mapper.readValue(json, RoundSnapshot.class);

        EventSnapshot events = snapshot.events();
        assertTrue(events.has(SourceCategory.FORECAST_MARKET));
        assertTrue(events.has(SourceCategory.ON_CHAIN));
        assertFalse(events.has(SourceCategory.NEWS));
        assertEquals(0.78, events.forecastMarket("fed_hike").orElseThrow().yesProbability());
        assertEquals(600_000_000d, events.onChain().totalExchangeInflowsUsd());
        assertEquals(140_000_000d, events.onChain().exchangeFlows().get("binance").usdt());
    }

    @Test
    @DisplayName("event snapshots serialise each category under its source-category key")
    void writesCategoryKeys() throws Exception {
        EventSnapshot events = new EventSnapshot(
            Map.of("btc_100k", ForecastMarket.of("btc_100k", 0.68)),
            new OnChainMetrics(450_000_000d, 0, 0, Map.of("coinbase", new ExchangeFlow(1, 2))),
            List.of());

        JsonNode node = mapper.readTree(mapper.writeValueAsString(events));

        for (SourceCategory category : SourceCategory.values()) {
            assertTrue(node.has(category.key()), category.key());
        }
        assertFalse(node.has("forecastMarkets"));
        assertFalse(node.has("onChain"));
    }

    @Test
    @DisplayName("round results serialise with ISO timestamps and without helper accessors")
    void writesRound() throws Exception {
        BattleRound round = new BattleRound(4, List.of(), null, SelectionMode.NONE,
            BattleRound.NO_SIGNAL_EXPLANATION, Instant.parse("2024-01-01T00:04:00Z"), List.of());

        JsonNode node = mapper.readTree(mapper.writeValueAsString(round));

        assertEquals(4, node.path("epoch").asLong());
        assertEquals("2024-01-01T00:04:00Z", node.path("timestamp").asText());
        assertEquals("NONE", node.path("selectionMode").asText());
        assertTrue(node.path("winner").isNull());
        assertFalse(node.has("hasWinner"));
        assertFalse(node.has("winnerOptional"));
    }
}
