package com.trade.sentinel.core.breaker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one breaker, safe to serialize.
 */
@Value
@Builder
public class CircuitBreakerStatus {
    String name;
    CircuitState state;
    boolean canProceed;
    int consecutiveFailures;
    int consecutiveSuccesses;
    long totalCalls;
    long totalSuccesses;
    long totalFailures;
    long totalRejected;
    long stateChanges;
    double successRatePct;
    double timeUntilRetrySeconds;
    Instant lastFailureAt;
    Instant lastSuccessAt;
    CircuitBreakerConfig config;
    List<RecentError> recentErrors;

    public record RecentError(Instant at, String type, String message) {
    }
}
