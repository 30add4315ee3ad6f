package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Market state supplied once per round. {@code price}, {@code bid} and {@code ask}
 * are nullable; a snapshot without a usable price yields no signal from agents that
 * need one.
 */
public record MarketSnapshot(
    @JsonProperty("symbol")    String  symbol,
    @JsonProperty("price")     Double  price,
    @JsonProperty("volume")    double  volume,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("bid")       Double  bid,
    @JsonProperty("ask")       Double  ask
) {

    public static MarketSnapshot of(String symbol, double price, double volume, Instant timestamp) {
        return new MarketSnapshot(symbol, price, volume, timestamp, null, null);
    }

    public boolean hasPrice() {
        return price != null && Double.isFinite(price) && price > 0.0;
    }
}
