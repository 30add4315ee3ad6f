package com.signalarena.orchestrator.ai;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;

import java.util.List;

/**
 * Everything an explainer may use to justify a round's winner.
 */
public record ExplanationRequest(
    long epoch,
    Signal winner,
    List<Signal> candidates,
    MarketSnapshot market,
    AgentPerformance winnerPerformance
) {

    public ExplanationRequest {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
