package com.trade.sentinel.core.breaker;

import com.trade.sentinel.common.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class CircuitBreakerConfig {

    @Builder.Default
    int failureThreshold = 5;
    @Builder.Default
    int successThreshold = 2;
    @Builder.Default
    Duration openTimeout = Duration.ofSeconds(60);
    @Builder.Default
    int halfOpenMaxProbes = 3;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }

    /**
     * @throws ConfigurationException when the thresholds cannot describe a working breaker
     */
    public CircuitBreakerConfig validate(String name) {
        String prefix = "breaker." + name + ".";
        if (failureThreshold < 1) throw new ConfigurationException(prefix + "failure-threshold", "must be >= 1");
        if (successThreshold < 1) throw new ConfigurationException(prefix + "success-threshold", "must be >= 1");
        if (halfOpenMaxProbes < 1) throw new ConfigurationException(prefix + "half-open-max-probes", "must be >= 1");
        if (openTimeout == null || openTimeout.isZero() || openTimeout.isNegative()) {
            throw new ConfigurationException(prefix + "open-timeout", "must be > 0");
        }
        if (successThreshold > halfOpenMaxProbes) {
            throw new ConfigurationException(prefix + "success-threshold",
                    "must not exceed half-open-max-probes (" + halfOpenMaxProbes + ")");
        }
        return this;
    }
}
