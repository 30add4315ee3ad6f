package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable record of one evaluation round.
 *
 * <p>{@code candidates} keeps agent iteration order. {@code winner} is {@code null}
 * when no agent produced an actionable signal; that is a normal outcome and is
 * recorded like any other round. {@code leaderboard} is sorted by cumulative pnl,
 * highest first.
 */
public record BattleRound(
    @JsonProperty("epoch")         long                   epoch,
    @JsonProperty("candidates")    List<Signal>           candidates,
    @JsonProperty("winner")        Signal                 winner,
    @JsonProperty("selectionMode") SelectionMode          selectionMode,
    @JsonProperty("explanation")   String                 explanation,
    @JsonProperty("timestamp")     Instant                timestamp,
    @JsonProperty("leaderboard")   List<AgentPerformance> leaderboard
) {

    public static final String NO_SIGNAL_EXPLANATION = "No actionable signal this round";

    public BattleRound {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        leaderboard = leaderboard == null ? List.of() : List.copyOf(leaderboard);
        selectionMode = selectionMode == null ? SelectionMode.NONE : selectionMode;
    }

    @JsonIgnore
    public Optional<Signal> winnerOptional() {
        return Optional.ofNullable(winner);
    }

    @JsonIgnore
    public boolean hasWinner() {
        return winner != null;
    }
}
