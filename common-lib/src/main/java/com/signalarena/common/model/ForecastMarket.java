package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One forecast-market contract, e.g. {@code btc_100k} with its current YES probability.
 */
public record ForecastMarket(
    @JsonProperty("key")            String key,
    @JsonProperty("title")          String title,
    @JsonProperty("yesProbability") double yesProbability,
    @JsonProperty("source")         String source
) {

    public static ForecastMarket of(String key, double yesProbability) {
        return new ForecastMarket(key, key, yesProbability, "polymarket");
    }
}
