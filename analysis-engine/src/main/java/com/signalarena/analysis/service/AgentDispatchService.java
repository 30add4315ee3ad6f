package com.signalarena.analysis.service;

import com.signalarena.analysis.agent.StrategyAgent;
import com.signalarena.analysis.config.AgentRoster;
import com.signalarena.common.exception.AgentException;
import com.signalarena.common.model.EventSnapshot;
import com.signalarena.common.model.MarketSnapshot;
import com.signalarena.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Runs every rostered agent against one round's snapshots.
 *
 * <p>Agents evaluate in parallel on the bounded-elastic scheduler, but results are
 * emitted in roster order so candidate order stays deterministic. HOLD signals are
 * dropped; a failing agent contributes no candidate and the round carries on.
 */
@Service
public class AgentDispatchService {

    private static final Logger log = LoggerFactory.getLogger(AgentDispatchService.class);
    private final List<StrategyAgent> agents;

    public AgentDispatchService(AgentRoster roster) {
        this.agents = roster.agents();
    }

    public Mono<List<Signal>> dispatchAll(MarketSnapshot market, EventSnapshot events) {
        log.debug("Dispatching {} agents for symbol={}", agents.size(), market != null ? market.symbol() : null);
        return Flux.fromIterable(agents)
            .flatMapSequential(agent -> Mono.fromCallable(() -> evaluate(agent, market, events).orElse(null))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(signal -> log.debug("Agent={} emitted. action={} confidence={}",
                    agent.agentName(), signal.action(), signal.confidence()))
                .onErrorResume(e -> {
                    log.error("Agent={} failed, no candidate this round. reason={}",
                              agent.agentName(), e.getMessage(), e);
                    return Mono.empty();
                }))
            .filter(Signal::isActionable)
            .collectList();
    }

    private static Optional<Signal> evaluate(StrategyAgent agent, MarketSnapshot market, EventSnapshot events) {
        try {
            Optional<Signal> signal = agent.evaluate(market, events);
            return signal == null ? Optional.empty() : signal;
        } catch (RuntimeException e) {
            throw e instanceof AgentException ? e : new AgentException(agent.agentName(), "evaluate failed", e);
        }
    }
}
