package com.trade.sentinel.service.decision;

/**
 * A read-only check consulted on every decision cycle.
 * <p>
 * Implementations must not mutate the context or touch the rate limiter, the breakers or the cache.
 * The orchestrator bounds each call with a timeout and turns any exception into a veto.
 * Register an implementation as a Spring bean to have it picked up; {@code @Order} fixes its position.
 */
public interface Evaluator {

    /**
     * Unique name, used in reasons, health reports and confidence weights.
     */
    String name();

    Verdict evaluate(DecisionContext context);
}
