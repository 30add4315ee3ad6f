package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Stablecoin flows into a single exchange over the reporting window, in USD. */
public record ExchangeFlow(
    @JsonProperty("usdc") double usdc,
    @JsonProperty("usdt") double usdt
) {
}
