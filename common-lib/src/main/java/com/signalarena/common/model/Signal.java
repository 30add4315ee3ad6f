package com.signalarena.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable decision candidate emitted by one agent for one round.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code confidence}: conviction in [0.0, 1.0], produced by the agent's own
 *       indicator or fusion formula</li>
 *   <li>{@code size}: proposed size, never negative</li>
 *   <li>{@code reason}: free-text audit trail of how the signal was derived</li>
 *   <li>{@code price}: market price observed when the signal was produced</li>
 * </ul>
 *
 * <p>A new instance is created every round; nothing mutates it afterwards.
 */
public record Signal(
    @JsonProperty("timestamp")  Instant      timestamp,
    @JsonProperty("symbol")     String       symbol,
    @JsonProperty("action")     SignalAction action,
    @JsonProperty("confidence") double       confidence,
    @JsonProperty("size")       double       size,
    @JsonProperty("reason")     String       reason,
    @JsonProperty("agentName")  String       agentName,
    @JsonProperty("price")      double       price
) {

    public static final double DEFAULT_SIZE = 100.0;

    public Signal {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(agentName, "agentName");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1] but was " + confidence);
        }
        if (Double.isNaN(size) || size < 0.0) {
            throw new IllegalArgumentException("size must be >= 0 but was " + size);
        }
        reason = reason == null ? "" : reason;
    }

    /**
     * Builds a signal stamped with the snapshot's symbol, price and timestamp.
     *
     * @throws IllegalArgumentException if the snapshot carries no usable price
     */
    public static Signal of(MarketSnapshot market, SignalAction action, double confidence,
                            double size, String reason, String agentName) {
        if (!market.hasPrice()) {
            throw new IllegalArgumentException("market snapshot has no usable price: " + market.price());
        }
        return new Signal(
            market.timestamp() != null ? market.timestamp() : Instant.now(),
            market.symbol(),
            action,
            confidence,
            size,
            reason,
            agentName,
            market.price()
        );
    }

    @JsonIgnore
    public boolean isActionable() {
        return action.isActionable();
    }
}
