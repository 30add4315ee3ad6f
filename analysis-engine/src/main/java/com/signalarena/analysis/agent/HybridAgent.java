package com.signalarena.analysis.agent;

import com.signalarena.analysis.detector.ForecastMarketDetector;
import com.signalarena.analysis.detector.NewsDetector;
import com.signalarena.analysis.detector.OnChainDetector;
import com.signalarena.analysis.detector.SourceDetector;
import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.consensus.ConfirmationResult;
import com.signalarena.common.consensus.SourceConfirmationPolicy;
import com.signalarena.common.consensus.SourceVote;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Multi-source confirmation agent.
 *
 * <p>Polls the forecast-market, on-chain and news detectors, then lets a
 * {@link SourceConfirmationPolicy} decide. A signal is only emitted when at least
 * {@code T} sources agree on direction; an even split between sources is itself
 * treated as a reason to stay out. The strict variant is this class with
 * {@code T = 3}.
 */
public class HybridAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(HybridAgent.class);

    private final String name;
    private final SourceConfirmationPolicy policy;
    private final List<SourceDetector> detectors;

    public HybridAgent(String name, SourceConfirmationPolicy policy, List<SourceDetector> detectors) {
        this.name = name;
        this.policy = policy;
        this.detectors = List.copyOf(detectors);
    }

    public HybridAgent(String name, int confirmationThreshold, double probabilityThreshold,
                       double inflowThresholdUsd, double newsImpactThreshold) {
        this(name, new SourceConfirmationPolicy(confirmationThreshold), List.of(
            new ForecastMarketDetector(probabilityThreshold),
            new OnChainDetector(inflowThresholdUsd),
            new NewsDetector(newsImpactThreshold, new SeenEventMemory())));
    }

    /** Two-of-three confirmation with default source thresholds. */
    public static HybridAgent majority(String name) {
        return new HybridAgent(name, SourceConfirmationPolicy.MAJORITY_THRESHOLD,
            ForecastMarketDetector.DEFAULT_THRESHOLD, OnChainDetector.DEFAULT_INFLOW_THRESHOLD_USD,
            NewsDetector.DEFAULT_IMPACT_THRESHOLD);
    }

    /** All sources must agree. */
    public static HybridAgent strict(String name) {
        return new HybridAgent(name, SourceConfirmationPolicy.STRICT_THRESHOLD,
            ForecastMarketDetector.DEFAULT_THRESHOLD, OnChainDetector.DEFAULT_INFLOW_THRESHOLD_USD,
            NewsDetector.DEFAULT_IMPACT_THRESHOLD);
    }

    @Override
    public String agentName() { return name; }

    public int confirmationThreshold() {
        return policy.confirmationThreshold();
    }

    @Override
    public synchronized Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice() || events == null) {
            return Optional.empty();
        }

        List<SourceVote> votes = detectors.stream().map(d -> d.vote(events)).toList();
        ConfirmationResult result = policy.evaluate(votes);

        if (!result.isConfirmed()) {
            log.debug("[{}] verdict={} reason={}", name, result.verdict(), result.reason());
            return Optional.empty();
        }

        log.debug("[{}] Confirmed {} confidence={} agreeing={}/{}", name, result.action(),
                  result.confidence(), result.agreeingVotes(), result.votingSources());
        return Optional.of(Signal.of(market, result.action(), result.confidence(),
                                     Signal.DEFAULT_SIZE, result.reason(), name));
    }
}
