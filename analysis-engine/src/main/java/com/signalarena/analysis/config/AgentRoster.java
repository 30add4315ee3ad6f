package com.signalarena.analysis.config;

import com.signalarena.analysis.agent.StrategyAgent;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, named set of competing agents. Iteration order is the candidate order
 * used for tie-breaking, so it is fixed here rather than left to bean discovery.
 */
public record AgentRoster(List<StrategyAgent> agents) {

    public AgentRoster {
        agents = List.copyOf(agents);
        Set<String> names = new HashSet<>();
        for (StrategyAgent agent : agents) {
            if (!names.add(agent.agentName())) {
                throw new IllegalArgumentException("duplicate agent name: " + agent.agentName());
            }
        }
    }

    public static AgentRoster of(StrategyAgent... agents) {
        return new AgentRoster(List.of(agents));
    }

    public List<String> names() {
        return agents.stream().map(StrategyAgent::agentName).toList();
    }
}
