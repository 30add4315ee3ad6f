package com.signalarena.analysis.detector;

import com.signalarena.common.consensus.SourceVote;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

/**
 * A directional reading taken from one evidence source.
 *
 * <ul>
 *   <li>{@code identity}: dedup key of the metric or event that triggered it</li>
 *   <li>{@code excess}: how far past its threshold the metric is, in the metric's
 *       own units (probability points, USD, impact score)</li>
 *   <li>{@code detail}: short human-readable description</li>
 * </ul>
 */
public record Detection(
    SourceCategory source,
    SignalAction   direction,
    String         identity,
    double         excess,
    String         detail
) {

    public SourceVote toVote() {
        return SourceVote.of(source, direction);
    }
}
