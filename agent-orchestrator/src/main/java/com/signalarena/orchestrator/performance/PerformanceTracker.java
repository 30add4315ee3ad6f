package com.signalarena.orchestrator.performance;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.TradeOutcome;
import com.signalarena.common.performance.PerformanceCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-agent outcome ledger for a session.
 *
 * <p>History is append-only. When a retention window is set, only the latest
 * {@code retentionWindow} outcomes are kept; derived statistics are always
 * recomputed from the retained history via {@link PerformanceCalculator}, so they
 * cannot drift from it. Epoch wins are counted independently of outcomes.
 */
public class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    static final Comparator<AgentPerformance> LEADERBOARD_ORDER =
        Comparator.comparingDouble(AgentPerformance::cumulativePnl).reversed()
                  .thenComparing(AgentPerformance::agentName);

    private final double annualizationFactor;
    private final int retentionWindow;
    private final Map<String, Ledger> ledgers = new ConcurrentHashMap<>();

    public PerformanceTracker() {
        this(PerformanceCalculator.DEFAULT_ANNUALIZATION_FACTOR, 0);
    }

    /**
     * @param annualizationFactor periods per year for the Sharpe ratio, must be positive
     * @param retentionWindow     max outcomes kept per agent; {@code 0} keeps everything
     */
    public PerformanceTracker(double annualizationFactor, int retentionWindow) {
        if (annualizationFactor <= 0) {
            throw new IllegalArgumentException("annualizationFactor must be > 0 but was " + annualizationFactor);
        }
        if (retentionWindow < 0) {
            throw new IllegalArgumentException("retentionWindow must be >= 0 but was " + retentionWindow);
        }
        this.annualizationFactor = annualizationFactor;
        this.retentionWindow = retentionWindow;
    }

    /** Makes agents visible on the leaderboard before they have any history. */
    public void register(Collection<String> agentNames) {
        agentNames.forEach(this::ledger);
    }

    public void recordOutcome(TradeOutcome outcome) {
        ledger(outcome.agentName()).append(outcome);
        log.debug("[Performance] Outcome recorded. agent={} pnl={}", outcome.agentName(), outcome.pnl());
    }

    public void recordEpochWin(String agentName) {
        ledger(agentName).epochWin();
    }

    public AgentPerformance performance(String agentName) {
        Ledger ledger = ledgers.get(agentName);
        return ledger == null ? AgentPerformance.empty(agentName) : ledger.summary();
    }

    public List<TradeOutcome> history(String agentName) {
        Ledger ledger = ledgers.get(agentName);
        return ledger == null ? List.of() : ledger.outcomes();
    }

    /** Current summary of every known agent, keyed by name. */
    public Map<String, AgentPerformance> snapshot() {
        return ledgers.values().stream()
            .map(Ledger::summary)
            .collect(Collectors.toUnmodifiableMap(AgentPerformance::agentName, Function.identity()));
    }

    /** Every known agent, highest cumulative pnl first, ties by name. */
    public List<AgentPerformance> leaderboard() {
        List<AgentPerformance> board = new ArrayList<>(snapshot().values());
        board.sort(LEADERBOARD_ORDER);
        return List.copyOf(board);
    }

    private Ledger ledger(String agentName) {
        return ledgers.computeIfAbsent(agentName, Ledger::new);
    }

    // ── per-agent state ──────────────────────────────────────────────────────

    private final class Ledger {

        private final String agentName;
        private final Deque<TradeOutcome> outcomes = new ArrayDeque<>();
        private long epochWins;

        Ledger(String agentName) {
            this.agentName = agentName;
        }

        synchronized void append(TradeOutcome outcome) {
            outcomes.addLast(outcome);
            if (retentionWindow > 0) {
                while (outcomes.size() > retentionWindow) {
                    outcomes.removeFirst();
                }
            }
        }

        synchronized void epochWin() {
            epochWins++;
        }

        synchronized List<TradeOutcome> outcomes() {
            return List.copyOf(outcomes);
        }

        synchronized AgentPerformance summary() {
            List<TradeOutcome> history = List.copyOf(outcomes);
            return new AgentPerformance(
                agentName,
                PerformanceCalculator.winRate(history),
                PerformanceCalculator.sharpeRatio(history, annualizationFactor),
                PerformanceCalculator.cumulativePnl(history),
                history.size(),
                epochWins);
        }
    }
}
