package com.trade.sentinel.core.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Thread-safe token bucket with fractional tokens.
 * <p>
 * Tokens refill continuously at {@code refillRatePerSecond} and never exceed {@code capacity}.
 * A rejected consume leaves the bucket untouched and reports how long the caller must wait.
 */
public final class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final double capacity;
    private final double refillRatePerSecond;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public TokenBucket(double capacity, double refillRatePerSecond, Clock clock) {
        if (!(capacity > 0)) throw new IllegalArgumentException("capacity must be > 0");
        if (!(refillRatePerSecond > 0)) throw new IllegalArgumentException("refillRatePerSecond must be > 0");
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.tokens = capacity;
        this.lastRefill = this.clock.instant();
    }

    public double capacity() {
        return capacity;
    }

    public double refillRatePerSecond() {
        return refillRatePerSecond;
    }

    /**
     * Takes {@code n} tokens when available, otherwise reports the wait without consuming.
     */
    public synchronized ConsumeResult consume(double n) {
        checkRequest(n);
        refill();
        if (tokens >= n) {
            tokens -= n;
            return ConsumeResult.ALLOWED;
        }
        return new ConsumeResult(false, (n - tokens) / refillRatePerSecond);
    }

    /**
     * Seconds until {@code n} tokens are available; 0 when they already are. Never consumes.
     */
    public synchronized double waitFor(double n) {
        checkRequest(n);
        refill();
        return tokens >= n ? 0d : (n - tokens) / refillRatePerSecond;
    }

    /**
     * Current token count after refill.
     */
    public synchronized double peek() {
        refill();
        return tokens;
    }

    /**
     * Back to a full bucket.
     */
    public synchronized void reset() {
        tokens = capacity;
        lastRefill = clock.instant();
    }

    private void checkRequest(double n) {
        if (!(n > 0)) throw new IllegalArgumentException("token request must be > 0, was " + n);
        if (n > capacity) {
            throw new IllegalArgumentException("token request " + n + " exceeds bucket capacity " + capacity);
        }
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsedNanos = Duration.between(lastRefill, now).toNanos();
        // a clock stepping backwards must not drain the bucket
        if (elapsedNanos <= 0) return;
        tokens = Math.min(capacity, tokens + (elapsedNanos / NANOS_PER_SECOND) * refillRatePerSecond);
        lastRefill = now;
    }

    public record ConsumeResult(boolean allowed, double waitSeconds) {
        static final ConsumeResult ALLOWED = new ConsumeResult(true, 0d);
    }
}
