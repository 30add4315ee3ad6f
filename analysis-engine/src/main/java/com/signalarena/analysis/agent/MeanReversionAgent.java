package com.signalarena.analysis.agent;

import com.signalarena.analysis.indicator.PriceWindow;
import com.signalarena.analysis.indicator.TechnicalIndicators;
import com.signalarena.analysis.indicator.TechnicalIndicators.Band;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.SignalAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Bollinger-band mean reversion over a fixed window.
 *
 * <pre>
 *   price &lt; mean − k·σ → BUY,  confidence = min(0.6 + (lower − price) / mean, 0.95)
 *   price &gt; mean + k·σ → SELL, confidence = min(0.6 + (price − upper) / mean, 0.95)
 * </pre>
 * Inside the band there is no actionable signal.
 */
public class MeanReversionAgent implements StrategyAgent {

    private static final Logger log = LoggerFactory.getLogger(MeanReversionAgent.class);

    static final double BASE_CONFIDENCE = 0.6;
    static final double MAX_CONFIDENCE  = 0.95;

    private final String name;
    private final int period;
    private final double bandWidth;
    private final PriceWindow window;

    public MeanReversionAgent(String name, int period, double bandWidth) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2 but was " + period);
        }
        if (bandWidth <= 0) {
            throw new IllegalArgumentException("bandWidth must be > 0 but was " + bandWidth);
        }
        this.name = name;
        this.period = period;
        this.bandWidth = bandWidth;
        this.window = new PriceWindow(period);
    }

    @Override
    public String agentName() { return name; }

    @Override
    public synchronized Optional<Signal> evaluate(MarketSnapshot market, EventSnapshot events) {
        if (market == null || !market.hasPrice()) {
            log.debug("[{}] No usable price, skipping", name);
            return Optional.empty();
        }
        double price = market.price();
        window.append(price);
        if (!window.hasAtLeast(period)) {
            return Optional.empty();
        }

        Band band = TechnicalIndicators.band(window.snapshot(), period, bandWidth);
        SignalAction action;
        double distance;
        if (price < band.lower()) {
            action = SignalAction.BUY;
            distance = band.lower() - price;
        } else if (price > band.upper()) {
            action = SignalAction.SELL;
            distance = price - band.upper();
        } else {
            return Optional.empty();
        }

        double confidence = Math.min(BASE_CONFIDENCE + distance / band.mean(), MAX_CONFIDENCE);
        String reason = String.format("Bollinger Bands: lower(%.2f), upper(%.2f), price(%.2f)",
            band.lower(), band.upper(), price);

        return Optional.of(Signal.of(market, action, confidence, Signal.DEFAULT_SIZE * confidence, reason, name));
    }
}
