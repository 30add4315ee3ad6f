package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Per-round input from the data-collection layer. {@code events} may be
 * {@code null} when no evidence source reported anything.
 */
public record RoundSnapshot(
    @JsonProperty("market") MarketSnapshot market,
    @JsonProperty("events") EventSnapshot  events
) {

    public RoundSnapshot {
        Objects.requireNonNull(market, "market");
        events = events == null ? EventSnapshot.empty() : events;
    }
}
