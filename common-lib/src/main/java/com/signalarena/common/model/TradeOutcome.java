package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Realised result of executing a winning {@link Signal}. Appended to the owning
 * agent's history; never modified afterwards.
 */
public record TradeOutcome(
    @JsonProperty("signal")         Signal  signal,
    @JsonProperty("pnl")            double  pnl,
    @JsonProperty("executionPrice") double  executionPrice,
    @JsonProperty("slippage")       double  slippage,
    @JsonProperty("recordedAt")     Instant recordedAt
) {

    public TradeOutcome {
        Objects.requireNonNull(signal, "signal");
        recordedAt = recordedAt == null ? Instant.now() : recordedAt;
    }

    public static TradeOutcome of(Signal signal, double pnl) {
        return new TradeOutcome(signal, pnl, signal.price(), 0.0, Instant.now());
    }

    public String agentName() {
        return signal.agentName();
    }

    @JsonIgnore
    public boolean isWin() {
        return pnl > 0.0;
    }
}
