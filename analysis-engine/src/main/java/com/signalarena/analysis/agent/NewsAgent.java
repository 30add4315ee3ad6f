package com.signalarena.analysis.agent;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Single-source agent reacting to breaking news.
 *
 * <p>Picks the unseen event with the highest effective impact (Fed events are
 * boosted by {@code fedMultiplier}) at or above the threshold, then:
 * <ul>
 *   <li>bullish / bearish sentiment → BUY / SELL, {@code min(0.88, 0.6 + impact/10)}</li>
 *   <li>neutral Fed event → SELL 0.65</li>
 *   <li>neutral SEC ETF event → BUY 0.70</li>
 * </ul>
 */
public class NewsAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(NewsAgent.class);

    public static final double DEFAULT_IMPACT_THRESHOLD = 2.0;
    public static final double DEFAULT_FED_MULTIPLIER   = 1.5;
    static final double MAX_CONFIDENCE = 0.88;

    private final String name;
    private final double impactThreshold;
    private final double fedMultiplier;
    private final SeenEventMemory seenEvents;

    public NewsAgent(String name, double impactThreshold, double fedMultiplier) {
        this(name, impactThreshold, fedMultiplier, new SeenEventMemory());
    }

    public NewsAgent(String name, double impactThreshold, double fedMultiplier, SeenEventMemory seenEvents) {
        this.name = name;
        this.impactThreshold = impactThreshold;
        this.fedMultiplier = fedMultiplier;
        this.seenEvents = seenEvents;
    }

    @Override
    public String agentName() { return name; }

    @Override
    public Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice() || events == null || !events.has(SourceCategory.NEWS)) {
            return Optional.empty();
        }

        NewsEvent best = null;
        double bestScore = 0.0;
        for (NewsEvent event : events.news()) {
            if (seenEvents.contains(event.identity())) continue;
            double score = event.isFrom("fed") ? event.impactScore() * fedMultiplier : event.impactScore();
            if (score >= impactThreshold && score > bestScore) {
                best = event;
                bestScore = score;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        seenEvents.markSeen(best.identity());

        SignalAction action;
        double confidence;
        if (best.sentiment() == Sentiment.BULLISH) {
            action = SignalAction.BUY;
            confidence = Math.min(MAX_CONFIDENCE, 0.6 + bestScore / 10);
        } else if (best.sentiment() == Sentiment.BEARISH) {
            action = SignalAction.SELL;
            confidence = Math.min(MAX_CONFIDENCE, 0.6 + bestScore / 10);
        } else if (best.isFrom("fed")) {
            action = SignalAction.SELL;
            confidence = 0.65;
        } else if (best.isFrom("sec") && best.title().toLowerCase(Locale.ROOT).contains("etf")) {
            action = SignalAction.BUY;
            confidence = 0.70;
        } else {
            log.debug("[{}] Neutral event with no source rule. identity={}", name, best.identity());
            return Optional.empty();
        }

        String title = best.title().length() > 80 ? best.title().substring(0, 80) + "..." : best.title();
        String reason = String.format("%s event (impact: %.1f): \"%s\" | Sentiment: %s | Keywords: %s",
            best.source().toUpperCase(Locale.ROOT), best.impactScore(), title,
            best.sentiment().name().toLowerCase(Locale.ROOT), String.join(", ", best.matchedKeywords()));

        return Optional.of(Signal.of(market, action, confidence, Signal.DEFAULT_SIZE, reason, name));
    }
}
