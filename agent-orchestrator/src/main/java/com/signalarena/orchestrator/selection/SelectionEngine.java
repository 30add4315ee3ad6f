package com.signalarena.orchestrator.selection;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.Signal;

import java.util.List;
import java.util.Map;

/**
 * Picks exactly one winner among a round's candidates.
 */
public interface SelectionEngine {

    /**
     * @param candidates  actionable signals in agent iteration order; may be empty
     * @param performance current record per agent name; agents without history may be absent
     * @param totalEpochs rounds played so far, including the current one
     * @return the decision; {@link SelectionDecision#none()} for an empty candidate list
     */
    SelectionDecision select(List<Signal> candidates, Map<String, AgentPerformance> performance, long totalEpochs);
}
