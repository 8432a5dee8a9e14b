package com.trade.sentinel.core.ratelimit;

import com.trade.sentinel.common.exception.ConfigurationException;

/**
 * One named ceiling: at most {@code maxUnits} per {@code windowSeconds}.
 * A weighted limit consumes the caller's request weight; every other limit consumes one unit per call.
 */
public record RateLimit(String name, long maxUnits, long windowSeconds, boolean weighted) {

    public RateLimit {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("rate-limit.name", "limit name is required");
        }
        if (maxUnits <= 0) {
            throw new ConfigurationException("rate-limit." + name + ".max-units", "must be > 0");
        }
        if (windowSeconds <= 0) {
            throw new ConfigurationException("rate-limit." + name + ".window-seconds", "must be > 0");
        }
    }

    public static RateLimit of(String name, long maxUnits, long windowSeconds) {
        return new RateLimit(name, maxUnits, windowSeconds, false);
    }

    public static RateLimit weighted(String name, long maxUnits, long windowSeconds) {
        return new RateLimit(name, maxUnits, windowSeconds, true);
    }

    public double refillRatePerSecond() {
        return (double) maxUnits / (double) windowSeconds;
    }
}
