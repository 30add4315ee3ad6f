package com.signalarena.analysis.agent;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Locale;
import java.util.Optional;

/**
 * Reacts to the first unseen Federal Reserve headline, keyword rules first:
 * hike/hawkish → SELL 0.82, cut/dovish → BUY 0.82, pause → BUY 0.72,
 * then sentiment → 0.75. Headlines matching nothing are skipped.
 */
public class FedNewsAgent implements StrategyAgent {

    private final String name;
    private final SeenEventMemory seenEvents = new SeenEventMemory();

    public FedNewsAgent(String name) {
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
            if (!event.isFrom("fed")) continue;
            if (!seenEvents.markSeen(event.identity())) continue;

            String title = event.title().toLowerCase(Locale.ROOT);
            SignalAction action;
            double confidence;
            String label;
            if (title.contains("hike") || title.contains("hawkish")) {
                action = SignalAction.SELL; confidence = 0.82; label = "Fed hawkish signal";
            } else if (title.contains("cut") || title.contains("dovish")) {
                action = SignalAction.BUY;  confidence = 0.82; label = "Fed dovish signal";
            } else if (title.contains("pause")) {
                action = SignalAction.BUY;  confidence = 0.72; label = "Fed pause signal";
            } else if (event.sentiment() == Sentiment.BULLISH) {
                action = SignalAction.BUY;  confidence = 0.75; label = "Fed bullish announcement";
            } else if (event.sentiment() == Sentiment.BEARISH) {
                action = SignalAction.SELL; confidence = 0.75; label = "Fed bearish announcement";
            } else {
                continue;
            }
            String reason = label + ": \"" + event.title() + "\"";
            return Optional.of(Signal.of(market, action, confidence, Signal.DEFAULT_SIZE, reason, name));
        }
        return Optional.empty();
    }
}
