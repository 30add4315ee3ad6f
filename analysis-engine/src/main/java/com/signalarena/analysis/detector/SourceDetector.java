package com.signalarena.analysis.detector;

import com.signalarena.common.consensus.SourceVote;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.SourceCategory;

import java.util.Optional;

/**
 * Maps one evidence category of an {@link EventSnapshot} to a BUY / SELL reading,
 * or to nothing when the source is absent or below every threshold.
 */
public interface SourceDetector {

    SourceCategory category();

    Optional<Detection> detect(EventSnapshot events);

    default SourceVote vote(EventSnapshot events) {
        return detect(events).map(Detection::toVote).orElseGet(() -> SourceVote.abstain(category()));
    }
}
