package com.trade.sentinel.config;

import com.trade.sentinel.core.breaker.CircuitBreakerRegistry;
import com.trade.sentinel.core.cache.CacheStore;
import com.trade.sentinel.core.cache.LruCacheStore;
import com.trade.sentinel.core.ratelimit.RateLimiter;
import com.trade.sentinel.service.health.HealthMonitor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide singletons of the resilience core: one rate limiter, one cache, one breaker registry
 * and one health monitor, all sharing the same clock.
 */
@Configuration
public class ControlPlaneConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(SentinelProperties properties, Clock clock) {
        return new RateLimiter(properties.getRateLimit().toRateLimits(), clock);
    }

    @Bean
    public CacheStore<Object> cacheStore(SentinelProperties properties, Clock clock) {
        SentinelProperties.Cache cfg = properties.getCache();
        return new LruCacheStore<>(cfg.getMaxSize(), cfg.getDefaultTtl(), clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(SentinelProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(properties.defaultBreakerConfig(), properties.breakerOverrides(), clock);
    }

    @Bean
    public HealthMonitor healthMonitor(SentinelProperties properties, Clock clock) {
        return new HealthMonitor(properties.getHealth(), clock);
    }
}
