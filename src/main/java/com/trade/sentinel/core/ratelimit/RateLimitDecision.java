package com.trade.sentinel.core.ratelimit;

/**
 * Outcome of a non-blocking admission check. When rejected, {@code limitName} names the ceiling
 * with the longest wait.
 */
public record RateLimitDecision(boolean allowed, double waitSeconds, String limitName) {

    static RateLimitDecision admitted() {
        return new RateLimitDecision(true, 0d, null);
    }
}
