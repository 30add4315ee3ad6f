package com.signalarena.analysis.agent;

import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;

import java.util.Optional;

/**
 * A decision policy competing in each round.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>touch no external state; the only mutable state allowed is the agent's own
 *       price window or seen-event memory</li>
 *   <li>return {@link Optional#empty()} when there is no actionable opinion, including
 *       when the snapshot lacks the data the agent needs</li>
 *   <li>never return a HOLD signal</li>
 * </ul>
 *
 * <p>Each instance is evaluated by at most one thread at a time; different agents may
 * run in parallel within a round.
 */
public interface StrategyAgent {

    String agentName();

    /**
     * @param market current market snapshot
     * @param events evidence from the independent sources; may be {@code null}
     * @return the agent's signal for this round, if any
     */
    Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events);
}
