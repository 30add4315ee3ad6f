package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/** Tone tag assigned by the news collector; unknown tags read as {@link #NEUTRAL}. */
public enum Sentiment {

    BULLISH,
    BEARISH,
    NEUTRAL;

    @JsonCreator
    public static Sentiment fromString(String value) {
        if ("bullish".equalsIgnoreCase(value)) return BULLISH;
        if ("bearish".equalsIgnoreCase(value)) return BEARISH;
        return NEUTRAL;
    }
}
