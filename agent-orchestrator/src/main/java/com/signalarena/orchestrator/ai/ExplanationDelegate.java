package com.signalarena.orchestrator.ai;

import reactor.core.publisher.Mono;

/**
 * External free-text explainer. Implementations may fail or time out; the
 * {@link ExplanationProvider} falls back to its own template when they do.
 */
public interface ExplanationDelegate {

    Mono<String> explain(ExplanationRequest request);
}
