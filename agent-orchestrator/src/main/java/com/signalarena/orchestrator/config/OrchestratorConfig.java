package com.signalarena.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalarena.analysis.config.AgentRoster;
import com.signalarena.common.selection.SelectionWeights;
import com.signalarena.orchestrator.ai.AnthropicExplanationDelegate;
import com.signalarena.orchestrator.ai.ExplanationProvider;
import com.signalarena.orchestrator.performance.PerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Random;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${arena.selection.epsilon:0.15}")
    private double epsilon;

    @Value("${arena.selection.confidence-weight:0.5}")
    private double confidenceWeight;

    @Value("${arena.selection.win-rate-weight:0.3}")
    private double winRateWeight;

    @Value("${arena.selection.epoch-win-weight:0.2}")
    private double epochWinWeight;

    @Value("${arena.selection.seed:#{null}}")
    private Long selectionSeed;

    @Value("${arena.performance.annualization-factor:252}")
    private double annualizationFactor;

    @Value("${arena.performance.retention-window:0}")
    private int retentionWindow;

    @Value("${arena.explanation.anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${arena.explanation.anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${arena.explanation.anthropic.model:claude-3-5-haiku-latest}")
    private String anthropicModel;

    @Value("${arena.explanation.anthropic.timeout-ms:4000}")
    private long explanationTimeoutMs;

    @Bean
    public SelectionWeights selectionWeights() {
        return new SelectionWeights(epsilon, confidenceWeight, winRateWeight, epochWinWeight);
    }

    @Bean
    public Random selectionRandom() {
        if (selectionSeed != null) {
            log.info("[Config] Selection random seeded. seed={}", selectionSeed);
            return new Random(selectionSeed);
        }
        return new Random();
    }

    @Bean
    public PerformanceTracker performanceTracker(AgentRoster roster) {
        PerformanceTracker tracker = new PerformanceTracker(annualizationFactor, retentionWindow);
        tracker.register(roster.names());
        return tracker;
    }

    @Bean
    public ExplanationProvider explanationProvider(WebClient.Builder builder, ObjectMapper objectMapper) {
        if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
            log.info("[Config] No Anthropic API key configured. Explanations use the deterministic template.");
            return new ExplanationProvider();
        }
        WebClient anthropicClient = builder
            .baseUrl(anthropicBaseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        return new ExplanationProvider(
            new AnthropicExplanationDelegate(anthropicClient, objectMapper, anthropicApiKey, anthropicModel),
            Duration.ofMillis(explanationTimeoutMs));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
