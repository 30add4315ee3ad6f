package com.signalarena.analysis.config;

import com.signalarena.analysis.agent.FedNewsAgent;
import com.signalarena.analysis.agent.FlowWatcherAgent;
import com.signalarena.analysis.agent.ForecastMarketAgent;
import com.signalarena.analysis.agent.HybridAgent;
import com.signalarena.analysis.agent.MeanReversionAgent;
import com.signalarena.analysis.agent.NewsAgent;
import com.signalarena.analysis.agent.OnChainAgent;
import com.signalarena.analysis.agent.SecAgent;
import com.signalarena.analysis.agent.TrendFollowerAgent;
import com.signalarena.common.consensus.SourceConfirmationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class AgentRosterConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentRosterConfig.class);

    @Value("${arena.agents.trend.fast-period:5}")
    private int trendFastPeriod;

    @Value("${arena.agents.trend.slow-period:20}")
    private int trendSlowPeriod;

    @Value("${arena.agents.mean-reversion.period:20}")
    private int meanReversionPeriod;

    @Value("${arena.agents.mean-reversion.band-width:2.0}")
    private double meanReversionBandWidth;

    @Value("${arena.agents.forecast-market.probability-threshold:0.65}")
    private double probabilityThreshold;

    @Value("${arena.agents.on-chain.inflow-threshold-usd:400000000}")
    private double inflowThresholdUsd;

    @Value("${arena.agents.news.impact-threshold:2.0}")
    private double newsImpactThreshold;

    @Value("${arena.agents.news.fed-multiplier:1.5}")
    private double fedMultiplier;

    @Value("${arena.agents.flow-watcher.threshold-usd:200000000}")
    private double flowThresholdUsd;

    @Bean
    public AgentRoster agentRoster() {
        AgentRoster roster = new AgentRoster(List.of(
            new TrendFollowerAgent("TrendFollower", trendFastPeriod, trendSlowPeriod),
            new MeanReversionAgent("MeanReversion", meanReversionPeriod, meanReversionBandWidth),
            new ForecastMarketAgent("ForecastMarket", probabilityThreshold),
            new OnChainAgent("OnChain", inflowThresholdUsd),
            new NewsAgent("News", newsImpactThreshold, fedMultiplier),
            new FedNewsAgent("FedNews"),
            new SecAgent("SecWatcher"),
            new FlowWatcherAgent("FlowWatcher", flowThresholdUsd),
            new HybridAgent("Hybrid", SourceConfirmationPolicy.MAJORITY_THRESHOLD,
                            probabilityThreshold, inflowThresholdUsd, newsImpactThreshold),
            new HybridAgent("HybridStrict", SourceConfirmationPolicy.STRICT_THRESHOLD,
                            probabilityThreshold, inflowThresholdUsd, newsImpactThreshold)
        ));
        log.info("[Roster] {} agents registered. names={}", roster.agents().size(), roster.names());
        return roster;
    }
}
