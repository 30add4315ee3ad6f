package com.signalarena.common.selection;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.Signal;

/**
 * Stateless exploit-score calculator for the selection engine.
 *
 * <p>An agent with no recorded history contributes a win rate of 0.0 and no epoch
 * wins, so its score is driven by signal confidence alone.
 */
public final class SelectionScoreCalculator {

    private SelectionScoreCalculator() {}

    /**
     * @param signal      candidate being scored
     * @param performance producing agent's current record; {@code null} = no history
     * @param totalEpochs rounds played so far, including the current one
     * @param weights     policy weights
     * @return weighted exploit score
     */
    public static double score(Signal signal, AgentPerformance performance,
                               long totalEpochs, SelectionWeights weights) {
        double winRate = performance == null ? 0.0 : performance.winRate();
        long epochWins = performance == null ? 0L : performance.epochWins();
        double epochWinShare = (double) epochWins / Math.max(totalEpochs, 1L);

        return signal.confidence() * weights.confidenceWeight()
             + winRate             * weights.winRateWeight()
             + epochWinShare       * weights.epochWinWeight();
    }
}
