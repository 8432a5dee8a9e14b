package com.trade.sentinel.service.execution;

import com.trade.sentinel.config.SentinelProperties;
import com.trade.sentinel.core.breaker.CircuitBreakerRegistry;
import com.trade.sentinel.core.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * The only path from the control plane to a dependency: rate limit first, then the dependency's
 * circuit breaker, then the operation itself.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuardedInvoker {

    private final RateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final SentinelProperties properties;

    /**
     * @param weight charged to weighted rate limits only
     * @throws IllegalArgumentException                                        when {@link #checkAction} rejects the call
     * @throws com.trade.sentinel.common.exception.RateLimitExceededException when capacity is not available in time
     * @throws com.trade.sentinel.common.exception.CircuitOpenException       when the dependency's breaker rejects
     */
    public <T> T invoke(String dependency, int weight, Supplier<T> operation) {
        checkAction(dependency, weight, operation);
        rateLimiter.acquire(weight, properties.getRateLimit().getAcquireTimeout());
        log.debug("Invoking '{}' (weight {})", dependency, weight);
        return breakers.get(dependency).call(operation);
    }

    /**
     * Rejects a malformed call before it spends rate-limit capacity or reaches a breaker.
     */
    public void checkAction(String dependency, int weight, Supplier<?> operation) {
        if (dependency == null || dependency.isBlank()) {
            throw new IllegalArgumentException("dependency is required");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation is required for '" + dependency + "'");
        }
        if (weight < 1 || weight > rateLimiter.maxWeight()) {
            throw new IllegalArgumentException("weight " + weight + " for '" + dependency
                    + "' must be between 1 and " + rateLimiter.maxWeight());
        }
    }
}
