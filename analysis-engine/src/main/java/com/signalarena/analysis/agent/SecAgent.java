package com.signalarena.analysis.agent;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Locale;
import java.util.Optional;

/**
 * SEC crypto announcements: ETF approval → BUY 0.92, ETF rejection or denial →
 * SELL 0.85, enforcement or fraud → SELL 0.73. Matching uses the collector's
 * keyword tags plus the title.
 */
public class SecAgent implements StrategyAgent {

    static final double ETF_APPROVAL_CONFIDENCE  = 0.92;
    static final double ETF_REJECTION_CONFIDENCE = 0.85;
    static final double ENFORCEMENT_CONFIDENCE   = 0.73;

    private final String name;
    private final SeenEventMemory seenEvents = new SeenEventMemory();

    public SecAgent(String name) {
        this.name = name;
    }

    @Override
    public String agentName() { return name; }

    @Override
    public Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice() || events == null || !events.has(SourceCategory.NEWS)) {
            return Optional.empty();
        }
        for (NewsEvent event : events.news()) {
            if (!event.isFrom("sec")) continue;
            if (!seenEvents.markSeen(event.identity())) continue;

            String title = event.title().toLowerCase(Locale.ROOT);
            boolean etf = event.matchedKeywords().contains("etf");
            if (etf && (title.contains("approve") || title.contains("approval"))) {
                return Optional.of(signal(market, SignalAction.BUY, ETF_APPROVAL_CONFIDENCE,
                    "SEC ETF APPROVAL: \"" + event.title() + "\""));
            }
            if (etf && (title.contains("reject") || title.contains("denial"))) {
                return Optional.of(signal(market, SignalAction.SELL, ETF_REJECTION_CONFIDENCE,
                    "SEC ETF REJECTION: \"" + event.title() + "\""));
            }
            if (event.matchedKeywords().contains("enforcement") || event.matchedKeywords().contains("fraud")) {
                return Optional.of(signal(market, SignalAction.SELL, ENFORCEMENT_CONFIDENCE,
                    "SEC enforcement action: \"" + event.title() + "\""));
            }
        }
        return Optional.empty();
    }

    private Signal signal(MarketSnapshot market, SignalAction action, double confidence, String reason) {
        return Signal.of(market, action, confidence, Signal.DEFAULT_SIZE, reason, name);
    }
}
