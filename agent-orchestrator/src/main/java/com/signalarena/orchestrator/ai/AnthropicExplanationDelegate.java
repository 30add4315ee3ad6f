package com.signalarena.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalarena.common.model.AgentPerformance;
import com.signalarena.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks the Anthropic Messages API for a short natural-language rationale.
 *
 * <p>Fully reactive, no {@code .block()}. Errors propagate to the caller;
 * {@link ExplanationProvider} owns the fallback and the timeout.
 */
public class AnthropicExplanationDelegate implements ExplanationDelegate {

    private static final Logger log = LoggerFactory.getLogger(AnthropicExplanationDelegate.class);

    static final String MESSAGES_PATH = "/v1/messages";
    static final int MAX_TOKENS = 200;

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;

    public AnthropicExplanationDelegate(WebClient anthropicClient, ObjectMapper objectMapper,
                                        String apiKey, String model) {
        this.anthropicClient = anthropicClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public Mono<String> explain(ExplanationRequest request) {
        return Mono.fromCallable(() -> buildPrompt(request))
            .flatMap(this::callAnthropicApi)
            .doOnSuccess(text -> log.info("[Explainer] Anthropic explanation received. epoch={} model={}",
                                          request.epoch(), model));
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String buildPrompt(ExplanationRequest request) {
        Signal winner = request.winner();
        StringBuilder sb = new StringBuilder();
        sb.append("You are explaining which trading agent won an evaluation round and why.\n");
        sb.append(String.format(Locale.ROOT, "Round: %d%n", request.epoch()));
        if (request.market() != null) {
            sb.append(String.format(Locale.ROOT, "Market: %s price=%s volume=%.0f%n",
                request.market().symbol(), request.market().price(), request.market().volume()));
        }
        sb.append("Candidates:\n");
        for (Signal candidate : request.candidates()) {
            sb.append(String.format(Locale.ROOT, "  - %s: %s confidence=%.2f reason=%s%n",
                candidate.agentName(), candidate.action(), candidate.confidence(), candidate.reason()));
        }
        sb.append(String.format(Locale.ROOT, "Winner: %s %s confidence=%.2f%n",
            winner.agentName(), winner.action(), winner.confidence()));
        AgentPerformance perf = request.winnerPerformance();
        if (perf != null) {
            sb.append(String.format(Locale.ROOT,
                "Winner record: pnl=%.2f winRate=%.2f sharpe=%.2f trades=%d epochWins=%d%n",
                perf.cumulativePnl(), perf.winRate(), perf.sharpeRatio(), perf.totalTrades(), perf.epochWins()));
        }
        sb.append("Reply with two or three plain sentences, no markdown.");
        return sb.toString();
    }

    // ── Anthropic API call ────────────────────────────────────────────────────

    private Mono<String> callAnthropicApi(String prompt) {
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", MAX_TOKENS,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri(MESSAGES_PATH)
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .map(this::extractText);
    }

    private String extractText(String response) {
        try {
            JsonNode content = objectMapper.readTree(response).path("content");
            if (!content.isArray() || content.isEmpty()) {
                throw new IllegalStateException("Anthropic response has no content blocks");
            }
            return content.get(0).path("text").asText();
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to extract text from Anthropic response", e);
        }
    }
}
