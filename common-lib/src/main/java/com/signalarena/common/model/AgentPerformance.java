package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time summary of one agent's record, as shown on the leaderboard and
 * consumed by the selection score.
 *
 * <ul>
 *   <li>{@code winRate}: fraction of recorded outcomes with positive pnl</li>
 *   <li>{@code sharpeRatio}: annualised mean/stddev of pnl</li>
 *   <li>{@code cumulativePnl}: sum of all recorded pnl</li>
 *   <li>{@code totalTrades}: outcomes currently retained in history</li>
 *   <li>{@code epochWins}: rounds this agent has won</li>
 * </ul>
 */
public record AgentPerformance(
    @JsonProperty("agentName")     String agentName,
    @JsonProperty("winRate")       double winRate,
    @JsonProperty("sharpeRatio")   double sharpeRatio,
    @JsonProperty("cumulativePnl") double cumulativePnl,
    @JsonProperty("totalTrades")   int    totalTrades,
    @JsonProperty("epochWins")     long   epochWins
) {

    public static AgentPerformance empty(String agentName) {
        return new AgentPerformance(agentName, 0.0, 0.0, 0.0, 0, 0);
    }
}
