package com.signalarena.common.selection;

/**
 * Tunables of the epsilon-greedy selection policy.
 *
 * <pre>
 *   exploit score = confidence × confidenceWeight
 *                 + winRate    × winRateWeight
 *                 + (epochWins / max(totalEpochs, 1)) × epochWinWeight
 * </pre>
 *
 * <p>{@link #defaults()} returns ε = 0.15 and weights 0.5 / 0.3 / 0.2.
 */
public record SelectionWeights(
    double epsilon,
    double confidenceWeight,
    double winRateWeight,
    double epochWinWeight
) {

    public static final double DEFAULT_EPSILON           = 0.15;
    public static final double DEFAULT_CONFIDENCE_WEIGHT = 0.5;
    public static final double DEFAULT_WIN_RATE_WEIGHT   = 0.3;
    public static final double DEFAULT_EPOCH_WIN_WEIGHT  = 0.2;

    public SelectionWeights {
        if (Double.isNaN(epsilon) || epsilon < 0.0 || epsilon > 1.0) {
            throw new IllegalArgumentException("epsilon must be in [0,1] but was " + epsilon);
        }
        if (confidenceWeight < 0.0 || winRateWeight < 0.0 || epochWinWeight < 0.0) {
            throw new IllegalArgumentException(String.format(
                "selection weights must be non-negative: confidence=%s winRate=%s epochWin=%s",
                confidenceWeight, winRateWeight, epochWinWeight));
        }
    }

    public static SelectionWeights defaults() {
        return new SelectionWeights(DEFAULT_EPSILON, DEFAULT_CONFIDENCE_WEIGHT,
                                    DEFAULT_WIN_RATE_WEIGHT, DEFAULT_EPOCH_WIN_WEIGHT);
    }

    public SelectionWeights withEpsilon(double newEpsilon) {
        return new SelectionWeights(newEpsilon, confidenceWeight, winRateWeight, epochWinWeight);
    }
}
