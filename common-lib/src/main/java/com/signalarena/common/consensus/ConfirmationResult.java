package com.signalarena.common.consensus;

import com.signalarena.common.model.SignalAction;

import java.util.List;

/**
 * Immutable output of a {@link SourceConfirmationPolicy} run.
 *
 * <p>{@code action} and {@code confidence} are only meaningful when
 * {@code verdict == CONFIRMED}; otherwise action is {@link SignalAction#HOLD} and
 * confidence is 0.0. {@code reason} is always populated, so conflicts and missing
 * evidence stay visible in logs.
 */
public record ConfirmationResult(
    ConfirmationVerdict verdict,
    SignalAction        action,
    double              confidence,
    int                 agreeingVotes,
    int                 votingSources,
    List<SourceVote>    votes,
    String              reason
) {

    public ConfirmationResult {
        votes = List.copyOf(votes);
    }

    public boolean isConfirmed() {
        return verdict == ConfirmationVerdict.CONFIRMED;
    }
}
