package com.signalarena.orchestrator.logger;

import com.signalarena.common.model.BattleRound;
import com.signalarena.common.trace.RoundTraceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a round's lifecycle. Pure side effects; no decisions are made here.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #ROUND_OPENED}         epoch assigned, snapshot accepted</li>
 *   <li>{@link #CANDIDATES_COLLECTED} every agent evaluated</li>
 *   <li>{@link #WINNER_SELECTED}      selection engine decided (or found no candidate)</li>
 *   <li>{@link #EXPLANATION_RENDERED} rationale produced</li>
 *   <li>{@link #ROUND_RECORDED}       round appended to session history</li>
 *   <li>{@link #OUTCOME_APPLIED}      trade outcome fed back to the winner's record</li>
 * </ol>
 *
 * <p>Inside a pipeline, with the round id read from the Reactor Context:
 * <pre>
 *     .doOnEach(battleFlowLogger.stage(BattleFlowLogger.CANDIDATES_COLLECTED))
 * </pre>
 */
@Component
public class BattleFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(BattleFlowLogger.class);

    public static final String ROUND_OPENED         = "ROUND_OPENED";
    public static final String CANDIDATES_COLLECTED = "CANDIDATES_COLLECTED";
    public static final String WINNER_SELECTED      = "WINNER_SELECTED";
    public static final String EXPLANATION_RENDERED = "EXPLANATION_RENDERED";
    public static final String ROUND_RECORDED       = "ROUND_RECORDED";
    public static final String OUTCOME_APPLIED      = "OUTCOME_APPLIED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on each
     * {@code onNext}. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String roundId = RoundTraceUtil.getRoundId(signal.getContextView());
            RoundTraceUtil.withMdc(roundId, () ->
                log.info("[BattleFlow] stage={} roundId={}", stageName, roundId)
            );
        };
    }

    public void logWithRoundId(String stageName, String roundId) {
        RoundTraceUtil.withMdc(roundId, () ->
            log.info("[BattleFlow] stage={} roundId={}", stageName, roundId)
        );
    }

    /** One-line summary of a finished round. */
    public void logRound(BattleRound round) {
        String roundId = RoundTraceUtil.roundId(round.epoch());
        RoundTraceUtil.withMdc(roundId, () ->
            log.info("[BattleFlow] stage={} epoch={} candidates={} winner={} action={} mode={} roundId={}",
                     ROUND_RECORDED, round.epoch(), round.candidates().size(),
                     round.hasWinner() ? round.winner().agentName() : "none",
                     round.hasWinner() ? round.winner().action() : "N/A",
                     round.selectionMode(), roundId)
        );
    }
}
