package com.signalarena.orchestrator.selection;

import com.signalarena.common.model.SelectionMode;
import com.signalarena.common.model.Signal;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one selection pass.
 *
 * <p>{@code winner} is {@code null} with mode {@link SelectionMode#NONE} when there
 * were no candidates. {@code scores} holds the exploit score of each candidate in
 * candidate order; it is empty when the pass explored without scoring.
 */
public record SelectionDecision(Signal winner, SelectionMode mode, List<Double> scores) {

    public SelectionDecision {
        scores = scores == null ? List.of() : List.copyOf(scores);
        mode = mode == null ? SelectionMode.NONE : mode;
    }

    public static SelectionDecision none() {
        return new SelectionDecision(null, SelectionMode.NONE, List.of());
    }

    public Optional<Signal> winnerOptional() {
        return Optional.ofNullable(winner);
    }
}
