package com.trade.sentinel.core.ratelimit;

import com.trade.sentinel.common.exception.ConfigurationException;
import com.trade.sentinel.common.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces several simultaneous ceilings on outbound calls.
 * <p>
 * A request is admitted only when every bucket can serve it, and then it is charged to every bucket
 * at once. The wait reported for a rejected request is the longest wait across the buckets.
 */
@Slf4j
public class RateLimiter {

    static final long MAX_POLL_MILLIS = 100L;

    private final Map<String, RateLimit> limits = new LinkedHashMap<>();
    private final Map<String, TokenBucket> buckets = new LinkedHashMap<>();
    private final Clock clock;
    private final Object lock = new Object();
    private final int maxWeight;

    private long totalRequests;
    private long totalAdmitted;
    private long totalBlocked;

    public RateLimiter(List<RateLimit> rateLimits, Clock clock) {
        if (rateLimits == null || rateLimits.isEmpty()) {
            throw new ConfigurationException("rate-limit.limits", "at least one limit is required");
        }
        this.clock = clock == null ? Clock.systemUTC() : clock;
        for (RateLimit limit : rateLimits) {
            if (limits.putIfAbsent(limit.name(), limit) != null) {
                throw new ConfigurationException("rate-limit.limits", "duplicate limit name " + limit.name());
            }
            buckets.put(limit.name(), new TokenBucket(limit.maxUnits(), limit.refillRatePerSecond(), this.clock));
        }
        this.maxWeight = (int) Math.min(Integer.MAX_VALUE, limits.values().stream()
                .filter(RateLimit::weighted)
                .mapToLong(RateLimit::maxUnits)
                .min()
                .orElse(Integer.MAX_VALUE));
        log.info("Rate limiter ready with limits {}", limits.keySet());
    }

    /**
     * Venue defaults: 50 orders per second, 1200 request weight per minute, 200000 orders per day.
     */
    public static List<RateLimit> defaultLimits() {
        return List.of(
                RateLimit.of("orders-per-second", 50, 1),
                RateLimit.weighted("weight-per-minute", 1200, 60),
                RateLimit.of("orders-per-day", 200_000, 86_400));
    }

    /**
     * Largest weight a single request may carry: the smallest weighted capacity.
     */
    public int maxWeight() {
        return maxWeight;
    }

    /**
     * Non-blocking admission check. Either every bucket is charged or none is.
     *
     * @param weight request weight charged to weighted buckets; other buckets are charged 1
     */
    public RateLimitDecision tryAcquire(int weight) {
        if (weight < 1) throw new IllegalArgumentException("weight must be >= 1, was " + weight);
        if (weight > maxWeight) {
            throw new IllegalArgumentException("weight " + weight + " exceeds the largest admissible weight " + maxWeight);
        }
        synchronized (lock) {
            totalRequests++;
            double maxWait = 0d;
            String blockingLimit = null;
            for (Map.Entry<String, TokenBucket> e : buckets.entrySet()) {
                double wait = e.getValue().waitFor(unitsFor(e.getKey(), weight));
                if (wait > maxWait) {
                    maxWait = wait;
                    blockingLimit = e.getKey();
                }
            }
            if (blockingLimit != null) {
                totalBlocked++;
                return new RateLimitDecision(false, maxWait, blockingLimit);
            }
            for (Map.Entry<String, TokenBucket> e : buckets.entrySet()) {
                e.getValue().consume(unitsFor(e.getKey(), weight));
            }
            totalAdmitted++;
            return RateLimitDecision.admitted();
        }
    }

    /**
     * Blocks until admitted or until {@code timeout} elapses, polling in steps of at most 100 ms.
     * A zero timeout makes exactly one attempt.
     *
     * @throws RateLimitExceededException when the deadline passes or the thread is interrupted
     */
    public void acquire(int weight, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout == null ? Duration.ZERO : timeout);
        while (true) {
            RateLimitDecision decision = tryAcquire(weight);
            if (decision.allowed()) return;

            long remainingMillis = Duration.between(clock.instant(), deadline).toMillis();
            if (remainingMillis <= 0) {
                log.debug("Acquire timed out on '{}' (retry after {}s)", decision.limitName(), decision.waitSeconds());
                throw new RateLimitExceededException(decision.limitName(), decision.waitSeconds());
            }
            long waitMillis = (long) Math.ceil(decision.waitSeconds() * 1000d);
            long sleepMillis = Math.max(1L, Math.min(Math.min(waitMillis, remainingMillis), MAX_POLL_MILLIS));
            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new RateLimitExceededException(decision.limitName(), decision.waitSeconds(), ie);
            }
        }
    }

    public RateLimiterStatus getStatus() {
        synchronized (lock) {
            List<RateLimiterStatus.BucketStatus> out = new ArrayList<>(buckets.size());
            for (Map.Entry<String, TokenBucket> e : buckets.entrySet()) {
                RateLimit limit = limits.get(e.getKey());
                double available = e.getValue().peek();
                double utilization = (1d - available / limit.maxUnits()) * 100d;
                out.add(new RateLimiterStatus.BucketStatus(limit.name(), limit.maxUnits(), limit.windowSeconds(),
                        limit.weighted(), available, utilization));
            }
            double blockRate = totalRequests == 0 ? 0d : (double) totalBlocked / totalRequests * 100d;
            return new RateLimiterStatus(Collections.unmodifiableList(out), totalRequests, totalAdmitted, totalBlocked, blockRate);
        }
    }

    /**
     * Refills every bucket and clears the counters.
     */
    public void reset() {
        synchronized (lock) {
            buckets.values().forEach(TokenBucket::reset);
            totalRequests = 0;
            totalAdmitted = 0;
            totalBlocked = 0;
        }
        log.info("Rate limiter reset");
    }

    private double unitsFor(String limitName, int weight) {
        return limits.get(limitName).weighted() ? weight : 1d;
    }
}
