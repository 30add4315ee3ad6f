package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A breaking-news item scored by the news collector.
 *
 * <p>{@code source} is a short tag such as {@code fed}, {@code sec} or {@code coindesk}.
 */
public record NewsEvent(
    @JsonProperty("source")          String       source,
    @JsonProperty("title")           String       title,
    @JsonProperty("summary")         String       summary,
    @JsonProperty("impactScore")     double       impactScore,
    @JsonProperty("sentiment")       Sentiment    sentiment,
    @JsonProperty("matchedKeywords") List<String> matchedKeywords
) {

    static final int IDENTITY_TITLE_CHARS = 50;

    public NewsEvent {
        source = source == null ? "unknown" : source;
        title = title == null ? "" : title;
        sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public static NewsEvent of(String source, String title, double impactScore, Sentiment sentiment) {
        return new NewsEvent(source, title, "", impactScore, sentiment, List.of());
    }

    /** Dedup identity: source plus the first 50 characters of the title. */
    public String identity() {
        String truncated = title.length() > IDENTITY_TITLE_CHARS
            ? title.substring(0, IDENTITY_TITLE_CHARS)
            : title;
        return source + "_" + truncated;
    }

    public boolean isFrom(String tag) {
        return source.equalsIgnoreCase(tag);
    }
}
