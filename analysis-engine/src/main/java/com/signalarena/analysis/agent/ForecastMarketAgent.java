package com.signalarena.analysis.agent;

import com.signalarena.analysis.detector.Detection;
import com.signalarena.analysis.detector.ForecastMarketDetector;
import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single-source agent trading forecast-market probabilities alone.
 *
 * <p>Confidence grows with the distance past the threshold:
 * {@code min(0.90, 0.60 + 2 × excess)}. A market reading (key and probability) that
 * already produced a signal is not acted on again.
 */
public class ForecastMarketAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(ForecastMarketAgent.class);

    static final double BASE_CONFIDENCE = 0.60;
    static final double EXCESS_SCALE    = 2.0;
    static final double MAX_CONFIDENCE  = 0.90;

    private final String name;
    private final ForecastMarketDetector detector;
    private final SeenEventMemory seenReadings;

    public ForecastMarketAgent(String name, double probabilityThreshold) {
        this(name, new ForecastMarketDetector(probabilityThreshold), new SeenEventMemory());
    }

    public ForecastMarketAgent(String name, ForecastMarketDetector detector, SeenEventMemory seenReadings) {
        this.name = name;
        this.detector = detector;
        this.seenReadings = seenReadings;
    }

    @Override
    public String agentName() { return name; }

    @Override
    public Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice()) return Optional.empty();

        Optional<Detection> reading = detector.detect(events);
        if (reading.isEmpty()) {
            return Optional.empty();
        }
        Detection detection = reading.get();
        if (!seenReadings.markSeen(detection.identity())) {
            log.debug("[{}] Reading already acted on. identity={}", name, detection.identity());
            return Optional.empty();
        }

        double confidence = Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + EXCESS_SCALE * detection.excess());
        String reason = detection.detail() + " → " + detection.direction();
        return Optional.of(Signal.of(market, detection.direction(), confidence, Signal.DEFAULT_SIZE, reason, name));
    }
}
