package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate capital-flow metrics for the on-chain source. All amounts are USD.
 *
 * <ul>
 *   <li>{@code totalExchangeInflowsUsd}: stablecoin inflows to exchanges</li>
 *   <li>{@code totalDefiTvlUsd}: total value locked across tracked protocols</li>
 *   <li>{@code stablecoinSupplyChange24hUsd}: signed 24h change of stablecoin supply</li>
 *   <li>{@code exchangeFlows}: per-exchange breakdown; may be empty</li>
 * </ul>
 */
public record OnChainMetrics(
    @JsonProperty("totalExchangeInflowsUsd")      double totalExchangeInflowsUsd,
    @JsonProperty("totalDefiTvlUsd")              double totalDefiTvlUsd,
    @JsonProperty("stablecoinSupplyChange24hUsd") double stablecoinSupplyChange24hUsd,
    @JsonProperty("exchangeFlows")                Map<String, ExchangeFlow> exchangeFlows
) {

    public OnChainMetrics {
        exchangeFlows = exchangeFlows == null ? Map.of() : Map.copyOf(exchangeFlows);
    }

    public static OnChainMetrics ofInflows(double totalExchangeInflowsUsd, double totalDefiTvlUsd) {
        return new OnChainMetrics(totalExchangeInflowsUsd, totalDefiTvlUsd, 0.0, Map.of());
    }
}
