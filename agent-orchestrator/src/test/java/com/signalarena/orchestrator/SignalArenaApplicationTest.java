package com.signalarena.orchestrator;

import com.signalarena.analysis.config.AgentRoster;
import com.signalarena.common.model.AgentPerformance;
import com.signalarena.orchestrator.service.BattleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "arena.simulation.enabled=true",
    "arena.simulation.rounds=15",
    "arena.selection.seed=3"
})
class SignalArenaApplicationTest {

    @Autowired
    private BattleService battleService;

    @Autowired
    private AgentRoster roster;

    @Test
    @DisplayName("context starts and the simulation plays every round")
    void simulationRuns() {
        assertEquals(15, battleService.currentEpoch());
        assertEquals(15, battleService.history().size());

        List<AgentPerformance> leaderboard = battleService.leaderboard();
        assertEquals(roster.agents().size(), leaderboard.size());
        for (int i = 1; i < leaderboard.size(); i++) {
            assertTrue(leaderboard.get(i - 1).cumulativePnl() >= leaderboard.get(i).cumulativePnl());
        }
    }
}
