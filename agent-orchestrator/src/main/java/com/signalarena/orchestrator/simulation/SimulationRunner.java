package com.signalarena.orchestrator.simulation;

import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.BattleRound;
import com.signalarena.common.model.OutcomeReport;
import com.signalarena.orchestrator.service.BattleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Drives a demo session from {@link SyntheticMarketFeed} and feeds a mock pnl,
 * {@code N(0,1) × 10}, back for each winner. Enabled with
 * {@code arena.simulation.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "arena.simulation", name = "enabled", havingValue = "true")
public class SimulationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    static final double PNL_SCALE = 10.0;

    private final BattleService battleService;

    @Value("${arena.simulation.rounds:50}")
    private int rounds;

    @Value("${arena.simulation.seed:42}")
    private long seed;

    @Value("${arena.simulation.symbol:BTCUSDT}")
    private String symbol;

    public SimulationRunner(BattleService battleService) {
        this.battleService = battleService;
    }

    @Override
    public void run(String... args) {
        log.info("[Simulation] Starting. rounds={} seed={} symbol={}", rounds, seed, symbol);
        SyntheticMarketFeed feed = new SyntheticMarketFeed(symbol, seed);
        Random pnlRandom = new Random(seed + 1);

        battleService.runSession(feed.snapshots(rounds))
            .doOnNext(round -> settle(round, pnlRandom))
            .blockLast();

        log.info("[Simulation] Finished after {} rounds. Leaderboard:", battleService.currentEpoch());
        int rank = 1;
        for (AgentPerformance perf : battleService.leaderboard()) {
            log.info("[Simulation] #{} {} pnl={} winRate={} sharpe={} trades={} epochWins={}",
                     rank++, perf.agentName(), String.format("%.2f", perf.cumulativePnl()),
                     String.format("%.2f", perf.winRate()), String.format("%.2f", perf.sharpeRatio()),
                     perf.totalTrades(), perf.epochWins());
        }
    }

    private void settle(BattleRound round, Random pnlRandom) {
        if (!round.hasWinner()) {
            log.info("[Simulation] epoch={} {}", round.epoch(), round.explanation());
            return;
        }
        double pnl = pnlRandom.nextGaussian() * PNL_SCALE;
        battleService.reportOutcome(new OutcomeReport(
            round.winner().agentName(), round.epoch(), pnl, round.winner().price(), 0.0));
        log.info("[Simulation] epoch={} {}", round.epoch(), round.explanation());
    }
}
