package com.signalarena.common.model;

/**
 * Independent evidence categories carried by an {@link EventSnapshot}.
 */
public enum SourceCategory {

    FORECAST_MARKET(EventSnapshot.FORECAST_MARKET_KEY, "Forecast market"),
    ON_CHAIN(EventSnapshot.ON_CHAIN_KEY, "On-chain"),
    NEWS(EventSnapshot.NEWS_KEY, "News");

    private final String key;
    private final String label;

    SourceCategory(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /** Field name of this category in a serialised {@link EventSnapshot}. */
    public String key() {
        return key;
    }

    /** Human-readable label used in reason strings. */
    public String label() {
        return label;
    }
}
