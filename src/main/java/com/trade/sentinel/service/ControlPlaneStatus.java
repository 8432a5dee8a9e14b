package com.trade.sentinel.service;

import com.trade.sentinel.common.enums.FlagName;
import com.trade.sentinel.core.breaker.CircuitBreakerStatus;
import com.trade.sentinel.core.cache.CacheStats;
import com.trade.sentinel.core.ratelimit.RateLimiterStatus;
import com.trade.sentinel.service.decision.DecisionStatus;
import com.trade.sentinel.service.health.HealthStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Everything an external metrics collector scrapes in one call.
 */
@Value
@Builder
public class ControlPlaneStatus {
    Instant asOf;
    DecisionStatus decision;
    HealthStatus health;
    Map<String, CircuitBreakerStatus> breakers;
    RateLimiterStatus rateLimiter;
    CacheStats cache;
    Map<FlagName, Boolean> flags;
}
