package com.signalarena.analysis.detector;

import com.signalarena.analysis.memory.SeenEventMemory;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.NewsEvent;
import com.signalarena.common.model.Sentiment;
import com.signalarena.common.model.SignalAction;
import com.signalarena.common.model.SourceCategory;

import java.util.Locale;
import java.util.Optional;

/**
 * Reads the news feed: takes the highest-impact event not seen before whose impact
 * reaches the threshold, marks it seen, and maps it to a direction.
 *
 * <p>Direction comes from sentiment; for neutral items the source decides:
 * Fed "hike"/"hawkish" → SELL, "cut"/"dovish" → BUY; SEC "etf" + "approve" → BUY,
 * "reject" → SELL.
 */
public class NewsDetector implements SourceDetector {

    public static final double DEFAULT_IMPACT_THRESHOLD = 2.0;

    private final double impactThreshold;
    private final SeenEventMemory seenEvents;

    public NewsDetector() {
        this(DEFAULT_IMPACT_THRESHOLD, new SeenEventMemory());
    }

    public NewsDetector(double impactThreshold, SeenEventMemory seenEvents) {
        this.impactThreshold = impactThreshold;
        this.seenEvents = seenEvents;
    }

    @Override
    public SourceCategory category() {
        return SourceCategory.NEWS;
    }

    @Override
    public Optional<Detection> detect(EventSnapshot events) {
        if (events == null || !events.has(SourceCategory.NEWS) || events.news().isEmpty()) {
            return Optional.empty();
        }

        NewsEvent best = null;
        for (NewsEvent event : events.news()) {
            if (seenEvents.contains(event.identity())) continue;
            if (event.impactScore() < impactThreshold) continue;
            if (best == null || event.impactScore() > best.impactScore()) {
                best = event;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        seenEvents.markSeen(best.identity());

        SignalAction direction = direction(best);
        if (direction == null) {
            return Optional.empty();
        }
        String detail = String.format("%s event \"%s\" impact %.1f, %s",
            best.source().toUpperCase(Locale.ROOT), best.title(), best.impactScore(),
            best.sentiment().name().toLowerCase(Locale.ROOT));
        return Optional.of(new Detection(SourceCategory.NEWS, direction, best.identity(),
                                         best.impactScore() - impactThreshold, detail));
    }

    static SignalAction direction(NewsEvent event) {
        if (event.sentiment() == Sentiment.BULLISH) return SignalAction.BUY;
        if (event.sentiment() == Sentiment.BEARISH) return SignalAction.SELL;

        String title = event.title().toLowerCase(Locale.ROOT);
        if (event.isFrom("fed")) {
            if (title.contains("hike") || title.contains("hawkish")) return SignalAction.SELL;
            if (title.contains("cut") || title.contains("dovish"))   return SignalAction.BUY;
        }
        if (event.isFrom("sec") && title.contains("etf")) {
            if (title.contains("approve")) return SignalAction.BUY;
            if (title.contains("reject"))  return SignalAction.SELL;
        }
        return null;
    }
}
