package com.trade.sentinel.core.breaker;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One breaker per dependency name, created on first use and kept for the life of the process.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig defaults;
    private final Map<String, CircuitBreakerConfig> overrides;
    private final Clock clock;

    public CircuitBreakerRegistry(CircuitBreakerConfig defaults, Map<String, CircuitBreakerConfig> overrides, Clock clock) {
        this.defaults = (defaults == null ? CircuitBreakerConfig.defaults() : defaults).validate("default");
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
        this.overrides.forEach((name, cfg) -> cfg.validate(name));
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public CircuitBreaker get(String dependencyName) {
        if (dependencyName == null || dependencyName.isBlank()) {
            throw new IllegalArgumentException("dependency name is required");
        }
        return breakers.computeIfAbsent(dependencyName, n -> {
            log.info("Creating circuit breaker '{}'", n);
            return new CircuitBreaker(n, overrides.getOrDefault(n, defaults), clock);
        });
    }

    public Set<String> names() {
        return new TreeSet<>(breakers.keySet());
    }

    public Map<String, CircuitBreakerStatus> getAllStatus() {
        Map<String, CircuitBreakerStatus> out = new LinkedHashMap<>();
        for (String name : names()) {
            out.put(name, breakers.get(name).getStatus());
        }
        return out;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
