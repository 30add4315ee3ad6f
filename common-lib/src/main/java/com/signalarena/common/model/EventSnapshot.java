package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-round evidence from the independent sources, keyed by {@link SourceCategory}.
 *
 * <p>A {@code null} category means that source has no opinion this round: the
 * collector had nothing, the fetch failed, or the cached value went stale. Agents
 * must treat that as absence, never as an error.
 *
 * <p>On the wire each category sits under its {@link SourceCategory#key()}; the
 * camel-case field names are accepted as aliases.
 */
public record EventSnapshot(
    @JsonProperty(EventSnapshot.FORECAST_MARKET_KEY) @JsonAlias("forecastMarkets") Map<String, ForecastMarket> forecastMarkets,
    @JsonProperty(EventSnapshot.ON_CHAIN_KEY)        @JsonAlias("onChain")         OnChainMetrics              onChain,
    @JsonProperty(EventSnapshot.NEWS_KEY)                                          List<NewsEvent>             news
) {

    public static final String FORECAST_MARKET_KEY = "forecast-market";
    public static final String ON_CHAIN_KEY        = "on-chain";
    public static final String NEWS_KEY            = "news";

    public EventSnapshot {
        forecastMarkets = forecastMarkets == null ? null : Map.copyOf(forecastMarkets);
        news = news == null ? null : List.copyOf(news);
    }

    public static EventSnapshot empty() {
        return new EventSnapshot(null, null, null);
    }

    public boolean has(SourceCategory category) {
        return switch (category) {
            case FORECAST_MARKET -> forecastMarkets != null;
            case ON_CHAIN        -> onChain != null;
            case NEWS            -> news != null;
        };
    }

    public Optional<ForecastMarket> forecastMarket(String key) {
        return forecastMarkets == null ? Optional.empty() : Optional.ofNullable(forecastMarkets.get(key));
    }

    public EventSnapshot withForecastMarkets(Map<String, ForecastMarket> markets) {
        return new EventSnapshot(markets, onChain, news);
    }

    public EventSnapshot withOnChain(OnChainMetrics metrics) {
        return new EventSnapshot(forecastMarkets, metrics, news);
    }

    public EventSnapshot withNews(List<NewsEvent> events) {
        return new EventSnapshot(forecastMarkets, onChain, events);
    }
}
