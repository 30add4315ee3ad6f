package com.signalarena.common.consensus;

import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Objects;

/**
 * One source's directional opinion for the current round.
 *
 * <p>{@code direction} is {@code null} when the source abstained (no data, or data
 * that did not cross any threshold). A non-null direction is always BUY or SELL.
 */
public record SourceVote(SourceCategory source, SignalAction direction) {

    public SourceVote {
        Objects.requireNonNull(source, "source");
        if (direction == SignalAction.HOLD) {
            direction = null;
        }
    }

    public static SourceVote of(SourceCategory source, SignalAction direction) {
        return new SourceVote(source, direction);
    }

    public static SourceVote abstain(SourceCategory source) {
        return new SourceVote(source, null);
    }

    public boolean hasOpinion() {
        return direction != null;
    }

    @Override
    public String toString() {
        return source.label() + ": " + (direction == null ? "no opinion" : direction.name());
    }
}
