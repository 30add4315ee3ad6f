package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Feedback sent by the execution layer once a round's winning signal has been
 * traded. {@code epoch} identifies the round whose winner was executed.
 */
public record OutcomeReport(
    @JsonProperty("agentName")      String agentName,
    @JsonProperty("epoch")          long   epoch,
    @JsonProperty("pnl")            double pnl,
    @JsonProperty("executionPrice") double executionPrice,
    @JsonProperty("slippage")       double slippage
) {}
