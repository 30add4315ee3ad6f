package com.signalarena.orchestrator.ai;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.BattleRound;
import com.signalarena.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;

/**
 * Renders the rationale for a round's winner.
 *
 * <p>The deterministic template is always available:
 * <pre>
 *   {agent} selected with {confidence}% confidence. {reason} | Track record: pnl=..., winRate=...%, trades=..., epochWins=...
 * </pre>
 * When an {@link ExplanationDelegate} is configured it is tried first, bounded by
 * {@code timeout}. Any failure, timeout or blank answer resolves to the template;
 * the returned {@code Mono} never errors.
 */
public class ExplanationProvider {

    private static final Logger log = LoggerFactory.getLogger(ExplanationProvider.class);

    private final ExplanationDelegate delegate;
    private final Duration timeout;

    /** Template-only provider. */
    public ExplanationProvider() {
        this(null, Duration.ZERO);
    }

    /**
     * @throws IllegalArgumentException if a delegate is given without a positive timeout
     */
    public ExplanationProvider(ExplanationDelegate delegate, Duration timeout) {
        if (delegate != null && (timeout == null || timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("delegate timeout must be positive but was " + timeout);
        }
        this.delegate = delegate;
        this.timeout = timeout;
    }

    public boolean hasDelegate() {
        return delegate != null;
    }

    public Mono<String> explain(ExplanationRequest request) {
        if (request == null || request.winner() == null) {
            return Mono.just(BattleRound.NO_SIGNAL_EXPLANATION);
        }
        String fallback = template(request.winner(), request.winnerPerformance());
        if (delegate == null) {
            return Mono.just(fallback);
        }

        return Mono.defer(() -> delegate.explain(request))
            .timeout(timeout)
            .filter(text -> text != null && !text.isBlank())
            .map(String::trim)
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("[Explainer] Delegate returned nothing. Using template. epoch={}", request.epoch());
                return fallback;
            }))
            .onErrorResume(e -> {
                log.warn("[Explainer] Delegate failed. Using template. epoch={} reason={}",
                         request.epoch(), e.getMessage());
                return Mono.just(fallback);
            });
    }

    /** Deterministic rationale from the winner and its current record. */
    public static String template(Signal winner, AgentPerformance performance) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s selected with %.0f%% confidence.",
                                winner.agentName(), winner.confidence() * 100));
        if (!winner.reason().isBlank()) {
            sb.append(' ').append(winner.reason());
        }
        AgentPerformance perf = performance != null ? performance : AgentPerformance.empty(winner.agentName());
        sb.append(String.format(Locale.ROOT,
            " | Track record: pnl=%.2f, winRate=%.0f%%, trades=%d, epochWins=%d",
            perf.cumulativePnl(), perf.winRate() * 100, perf.totalTrades(), perf.epochWins()));
        return sb.toString();
    }
}
