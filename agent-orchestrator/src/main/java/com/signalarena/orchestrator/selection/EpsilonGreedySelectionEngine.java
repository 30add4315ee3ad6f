package com.signalarena.orchestrator.selection;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.SelectionMode;
import com.signalarena.common.model.Signal;
import com.signalarena.common.selection.SelectionScoreCalculator;
import com.signalarena.common.selection.SelectionWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Epsilon-greedy bandit over the round's candidates.
 *
 * <ul>
 *   <li>With probability ε: uniform random pick (EXPLORE).</li>
 *   <li>Otherwise: highest {@link SelectionScoreCalculator} score (EXPLOIT); ties go
 *       to the earliest candidate.</li>
 * </ul>
 *
 * <p>The {@link Random} is one shared stream for the engine's lifetime and is never
 * re-seeded, so the long-run exploration rate converges to ε. Callers run rounds
 * sequentially; the engine itself holds no other state.
 */
@Component
public class EpsilonGreedySelectionEngine implements SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(EpsilonGreedySelectionEngine.class);

    private final SelectionWeights weights;
    private final Random random;

    public EpsilonGreedySelectionEngine(SelectionWeights weights, Random selectionRandom) {
        this.weights = weights;
        this.random = selectionRandom;
    }

    @Override
    public SelectionDecision select(List<Signal> candidates, Map<String, AgentPerformance> performance,
                                    long totalEpochs) {
        if (candidates == null || candidates.isEmpty()) {
            return SelectionDecision.none();
        }

        if (random.nextDouble() < weights.epsilon()) {
            Signal pick = candidates.get(random.nextInt(candidates.size()));
            log.debug("[Selection] EXPLORE winner={} candidates={}", pick.agentName(), candidates.size());
            return new SelectionDecision(pick, SelectionMode.EXPLORE, List.of());
        }

        List<Double> scores = new ArrayList<>(candidates.size());
        int best = 0;
        for (int i = 0; i < candidates.size(); i++) {
            Signal candidate = candidates.get(i);
            double score = SelectionScoreCalculator.score(
                candidate, performance.get(candidate.agentName()), totalEpochs, weights);
            scores.add(score);
            // strict > keeps the earliest candidate on ties
            if (score > scores.get(best)) {
                best = i;
            }
        }
        Signal winner = candidates.get(best);
        log.debug("[Selection] EXPLOIT winner={} score={} scores={}", winner.agentName(), scores.get(best), scores);
        return new SelectionDecision(winner, SelectionMode.EXPLOIT, scores);
    }
}
