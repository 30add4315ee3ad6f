package com.signalarena.common.consensus;

import com.signalarena.common.model.SignalAction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Multi-source confirmation: fuses independent per-source directional votes into a
 * single conviction-scored decision.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Keep only votes with an opinion: {@code n} voters, {@code b} BUY, {@code s} SELL.</li>
 *   <li>{@code n < T} → {@link ConfirmationVerdict#INSUFFICIENT_EVIDENCE}.</li>
 *   <li>{@code max(b, s) < T} → {@link ConfirmationVerdict#SOURCE_CONFLICT}.</li>
 *   <li>Otherwise BUY if {@code b >= T}, else SELL, with
 *       {@code confidence = min(1.0, 0.70 + 0.07 × agreeing)}.</li>
 * </ol>
 *
 * <h3>Conviction scaling</h3>
 * <pre>
 *   2 agreeing → 0.84
 *   3 agreeing → 0.91
 * </pre>
 *
 * <p>Majority mode uses {@code T = 2}; strict mode is the same policy with
 * {@code T = 3}. This class is stateless and thread-safe.
 */
public final class SourceConfirmationPolicy {

    public static final int MAJORITY_THRESHOLD = 2;
    public static final int STRICT_THRESHOLD   = 3;

    static final double BASE_CONFIDENCE     = 0.70;
    static final double PER_VOTE_CONFIDENCE = 0.07;
    static final double MAX_CONFIDENCE      = 1.0;

    private final int confirmationThreshold;

    public SourceConfirmationPolicy(int confirmationThreshold) {
        if (confirmationThreshold < 1) {
            throw new IllegalArgumentException(
                "confirmationThreshold must be >= 1 but was " + confirmationThreshold);
        }
        this.confirmationThreshold = confirmationThreshold;
    }

    public static SourceConfirmationPolicy majority() {
        return new SourceConfirmationPolicy(MAJORITY_THRESHOLD);
    }

    public static SourceConfirmationPolicy strict() {
        return new SourceConfirmationPolicy(STRICT_THRESHOLD);
    }

    public int confirmationThreshold() {
        return confirmationThreshold;
    }

    /**
     * @param votes one entry per consulted source; abstentions are allowed
     * @return the verdict with an audit reason: never {@code null}
     */
    public ConfirmationResult evaluate(List<SourceVote> votes) {
        List<SourceVote> cast = votes.stream().filter(SourceVote::hasOpinion).toList();
        int n = cast.size();
        int buyVotes  = (int) cast.stream().filter(v -> v.direction() == SignalAction.BUY).count();
        int sellVotes = (int) cast.stream().filter(v -> v.direction() == SignalAction.SELL).count();

        if (n < confirmationThreshold) {
            return new ConfirmationResult(ConfirmationVerdict.INSUFFICIENT_EVIDENCE, SignalAction.HOLD, 0.0,
                Math.max(buyVotes, sellVotes), n, cast,
                String.format("Insufficient evidence: %d/%d sources voted (need %d) | %s",
                    n, votes.size(), confirmationThreshold, describe(votes)));
        }

        if (Math.max(buyVotes, sellVotes) < confirmationThreshold) {
            return new ConfirmationResult(ConfirmationVerdict.SOURCE_CONFLICT, SignalAction.HOLD, 0.0,
                Math.max(buyVotes, sellVotes), n, cast,
                String.format("Sources conflict: %d BUY vs %d SELL (need %d agreeing) | %s",
                    buyVotes, sellVotes, confirmationThreshold, describe(votes)));
        }

        SignalAction action = buyVotes >= confirmationThreshold ? SignalAction.BUY : SignalAction.SELL;
        int agreeing = action == SignalAction.BUY ? buyVotes : sellVotes;
        double confidence = conviction(agreeing);

        String reason = String.format("%d/%d sources confirm %s | %s | Multi-source conviction: %.0f%%",
            agreeing, n, action, describe(votes), confidence * 100);

        return new ConfirmationResult(ConfirmationVerdict.CONFIRMED, action, confidence, agreeing, n, cast, reason);
    }

    /** Conviction for a given number of agreeing sources, capped at 1.0. */
    public static double conviction(int agreeingVotes) {
        return Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + PER_VOTE_CONFIDENCE * agreeingVotes);
    }

    private static String describe(List<SourceVote> votes) {
        if (votes.isEmpty()) return "no source opinions";
        return votes.stream().map(SourceVote::toString).collect(Collectors.joining(" + "));
    }
}
