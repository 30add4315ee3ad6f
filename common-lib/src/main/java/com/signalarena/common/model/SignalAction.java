package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Direction proposed by a {@link Signal}.
 *
 * <p>Only {@link #BUY} and {@link #SELL} are actionable; a {@link #HOLD} is never
 * eligible for selection and is filtered out before a round picks its winner.
 */
public enum SignalAction {

    BUY,
    SELL,
    HOLD;

    public boolean isActionable() {
        return this != HOLD;
    }

    public SignalAction opposite() {
        return switch (this) {
            case BUY  -> SELL;
            case SELL -> BUY;
            case HOLD -> HOLD;
        };
    }

    /** Lenient parse; anything unrecognised maps to {@link #HOLD}. */
    @JsonCreator
    public static SignalAction fromString(String value) {
        if ("BUY".equalsIgnoreCase(value))  return BUY;
        if ("SELL".equalsIgnoreCase(value)) return SELL;
        return HOLD;
    }
}
