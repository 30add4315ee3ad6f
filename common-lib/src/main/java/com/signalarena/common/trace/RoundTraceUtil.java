package com.signalarena.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the current round id through reactive pipelines and into log lines.
 *
 * <p>The Reactor Context holds the round id for the lifetime of a round pipeline.
 * MDC is written only around a single log call and cleared straight after, since
 * reactive operators hop threads.
 */
public final class RoundTraceUtil {

    public static final String ROUND_ID_KEY = "roundId";
    static final String UNKNOWN = "unknown";

    private RoundTraceUtil() {}

    /** Formats an epoch as the round id used in logs, e.g. {@code round-42}. */
    public static String roundId(long epoch) {
        return "round-" + epoch;
    }

    public static <T> Mono<T> withRoundId(Mono<T> mono, long epoch) {
        return mono.contextWrite(ctx -> ctx.put(ROUND_ID_KEY, roundId(epoch)));
    }

    /** @return the round id stored in {@code ctx}, or {@code "unknown"} */
    public static String getRoundId(ContextView ctx) {
        return ctx.getOrDefault(ROUND_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String roundId, Runnable logAction) {
        MDC.put(ROUND_ID_KEY, roundId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ROUND_ID_KEY);
        }
    }
}
