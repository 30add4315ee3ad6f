package com.signalarena.orchestrator.service;

import com.signalarena.analysis.service.AgentDispatchService;
import com.signalarena.common.exception.UnknownRoundException;
import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.BattleRound;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.OutcomeReport;
import com.signalarena.common.model.RoundSnapshot;
import com.signalarena.common.model.Signal;
import com.signalarena.common.model.TradeOutcome;
import com.signalarena.common.trace.RoundTraceUtil;
import com.signalarena.orchestrator.ai.ExplanationProvider;
import com.signalarena.orchestrator.ai.ExplanationRequest;
import com.signalarena.orchestrator.logger.BattleFlowLogger;
import com.signalarena.orchestrator.performance.PerformanceTracker;
import com.signalarena.orchestrator.selection.SelectionDecision;
import com.signalarena.orchestrator.selection.SelectionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs evaluation rounds and keeps the session's round history.
 *
 * <p>Round pipeline:
 * <pre>
 *   epoch++ → dispatch agents → select winner → count epoch win
 *           → explain → record round (with leaderboard)
 * </pre>
 * The epoch is assigned when the round's {@code Mono} is subscribed. Rounds must
 * not overlap: use {@link #runSession(Flux)} or wait for each {@link #runRound}
 * to complete before starting the next.
 *
 * <p>Outcome reports are the only path that changes an agent's trade history, and
 * only the winner of the referenced round is updated.
 */
@Service
public class BattleService {

    private static final Logger log = LoggerFactory.getLogger(BattleService.class);

    private final AgentDispatchService dispatchService;
    private final SelectionEngine selectionEngine;
    private final PerformanceTracker performanceTracker;
    private final ExplanationProvider explanationProvider;
    private final BattleFlowLogger flowLogger;

    private final AtomicLong epochCounter = new AtomicLong();
    private final List<BattleRound> history = new ArrayList<>();
    private final Map<Long, BattleRound> roundsByEpoch = new ConcurrentHashMap<>();
    private final Set<Long> reportedEpochs = new HashSet<>();

    public BattleService(AgentDispatchService dispatchService,
                         SelectionEngine selectionEngine,
                         PerformanceTracker performanceTracker,
                         ExplanationProvider explanationProvider,
                         BattleFlowLogger flowLogger) {
        this.dispatchService = dispatchService;
        this.selectionEngine = selectionEngine;
        this.performanceTracker = performanceTracker;
        this.explanationProvider = explanationProvider;
        this.flowLogger = flowLogger;
    }

    // ── rounds ────────────────────────────────────────────────────────────────

    /**
     * Evaluates one round. Never errors for data problems: an empty candidate set
     * produces a round without a winner.
     */
    public Mono<BattleRound> runRound(MarketSnapshot market, EventSnapshot events) {
        return Mono.defer(() -> {
            long epoch = epochCounter.incrementAndGet();
            String roundId = RoundTraceUtil.roundId(epoch);
            flowLogger.logWithRoundId(BattleFlowLogger.ROUND_OPENED, roundId);

            Mono<BattleRound> round = dispatchService.dispatchAll(market, events)
                .doOnEach(flowLogger.stage(BattleFlowLogger.CANDIDATES_COLLECTED))
                .flatMap(candidates -> decide(epoch, market, candidates));
            return RoundTraceUtil.withRoundId(round, epoch);
        });
    }

    public Mono<BattleRound> runRound(RoundSnapshot snapshot) {
        return runRound(snapshot.market(), snapshot.events());
    }

    /** Runs rounds strictly one after another, in snapshot order. */
    public Flux<BattleRound> runSession(Flux<RoundSnapshot> snapshots) {
        return snapshots.concatMap(this::runRound);
    }

    private Mono<BattleRound> decide(long epoch, MarketSnapshot market, List<Signal> candidates) {
        SelectionDecision decision = selectionEngine.select(candidates, performanceTracker.snapshot(), epoch);
        String roundId = RoundTraceUtil.roundId(epoch);

        if (decision.winner() == null) {
            RoundTraceUtil.withMdc(roundId, () ->
                log.info("[Battle] No actionable signal. epoch={} roundId={}", epoch, roundId));
            return Mono.just(record(new BattleRound(epoch, candidates, null, decision.mode(),
                BattleRound.NO_SIGNAL_EXPLANATION, Instant.now(), performanceTracker.leaderboard())));
        }

        Signal winner = decision.winner();
        performanceTracker.recordEpochWin(winner.agentName());
        RoundTraceUtil.withMdc(roundId, () ->
            log.info("[BattleFlow] stage={} epoch={} winner={} action={} confidence={} mode={} scores={} roundId={}",
                     BattleFlowLogger.WINNER_SELECTED, epoch, winner.agentName(), winner.action(),
                     winner.confidence(), decision.mode(), decision.scores(), roundId));

        ExplanationRequest request = new ExplanationRequest(
            epoch, winner, candidates, market, performanceTracker.performance(winner.agentName()));

        return explanationProvider.explain(request)
            .doOnEach(flowLogger.stage(BattleFlowLogger.EXPLANATION_RENDERED))
            .map(explanation -> record(new BattleRound(epoch, candidates, winner, decision.mode(),
                explanation, Instant.now(), performanceTracker.leaderboard())));
    }

    private BattleRound record(BattleRound round) {
        synchronized (history) {
            history.add(round);
        }
        roundsByEpoch.put(round.epoch(), round);
        flowLogger.logRound(round);
        return round;
    }

    // ── outcome feedback ──────────────────────────────────────────────────────

    /**
     * Applies a realised trade result to the winner of the referenced round.
     *
     * @return the agent's updated record
     * @throws UnknownRoundException when the epoch is unknown, the round had no
     *         winner, or the reporting agent is not that round's winner
     * @throws IllegalStateException when an outcome was already applied for the epoch
     */
    public AgentPerformance reportOutcome(OutcomeReport report) {
        BattleRound round = roundsByEpoch.get(report.epoch());
        if (round == null) {
            throw new UnknownRoundException(report.epoch(), "no such round in session history");
        }
        Signal winner = round.winnerOptional()
            .orElseThrow(() -> new UnknownRoundException(report.epoch(), "round had no winner"));
        if (!winner.agentName().equals(report.agentName())) {
            throw new UnknownRoundException(report.epoch(),
                "agent " + report.agentName() + " did not win this round (winner " + winner.agentName() + ")");
        }
        synchronized (reportedEpochs) {
            if (!reportedEpochs.add(report.epoch())) {
                throw new IllegalStateException("outcome already reported for epoch " + report.epoch());
            }
        }

        performanceTracker.recordOutcome(new TradeOutcome(
            winner, report.pnl(), report.executionPrice(), report.slippage(), Instant.now()));
        AgentPerformance updated = performanceTracker.performance(winner.agentName());

        String roundId = RoundTraceUtil.roundId(report.epoch());
        RoundTraceUtil.withMdc(roundId, () ->
            log.info("[BattleFlow] stage={} agent={} pnl={} winRate={} cumulativePnl={} roundId={}",
                     BattleFlowLogger.OUTCOME_APPLIED, updated.agentName(), report.pnl(),
                     updated.winRate(), updated.cumulativePnl(), roundId));
        return updated;
    }

    // ── queries ───────────────────────────────────────────────────────────────

    public List<BattleRound> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    public Optional<BattleRound> round(long epoch) {
        return Optional.ofNullable(roundsByEpoch.get(epoch));
    }

    public List<AgentPerformance> leaderboard() {
        return performanceTracker.leaderboard();
    }

    public long currentEpoch() {
        return epochCounter.get();
    }
}
