package com.trade.sentinel.core.breaker;

import com.trade.sentinel.common.Result;
import com.trade.sentinel.common.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Closed/Open/HalfOpen guard around one external dependency.
 * <p>
 * Closed lets calls through and opens after {@code failureThreshold} consecutive failures. Open
 * rejects calls until {@code openTimeout} has passed since the last failure; the next attempt after
 * that moves the breaker to HalfOpen. HalfOpen admits at most {@code halfOpenMaxProbes} probes,
 * reopens on any probe failure and closes after {@code successThreshold} consecutive successes.
 * <p>
 * State lives under one lock; the wrapped operation always runs outside of it.
 */
@Slf4j
public class CircuitBreaker {

    static final int RECENT_ERRORS = 10;
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Object lock = new Object();

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int halfOpenAdmitted;
    /** Bumped on every transition; ties a probe to the HalfOpen period that admitted it. */
    private long generation;
    private Instant lastFailureAt;
    private Instant lastSuccessAt;

    private long totalCalls;
    private long totalSuccesses;
    private long totalFailures;
    private long totalRejected;
    private long stateChanges;
    private final Deque<CircuitBreakerStatus.RecentError> recentErrors = new ArrayDeque<>(RECENT_ERRORS);

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = (config == null ? CircuitBreakerConfig.defaults() : config).validate(name);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String getName() {
        return name;
    }

    public CircuitState getState() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Runs {@code operation} when the breaker admits it.
     * <p>
     * A thrown exception is recorded and rethrown unchanged. A returned {@link Result} that failed is
     * recorded as a failure and still handed back to the caller.
     *
     * @throws CircuitOpenException when the call is rejected; the operation is not invoked
     */
    public <T> T call(Supplier<T> operation) {
        long probeOf = acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            onFailure(e.getClass().getSimpleName(), e.getMessage());
            throw e;
        }
        if (result instanceof Result && ((Result<?>) result).isFailure()) {
            onFailure("ReturnedError", Result.errorOf((Result<?>) result));
        } else {
            onSuccess(probeOf);
        }
        return result;
    }

    /**
     * True when a call made now would be admitted. Does not change state.
     */
    public boolean canProceed() {
        synchronized (lock) {
            return canProceedLocked(clock.instant());
        }
    }

    /**
     * Manual reset to Closed with cleared consecutive counters.
     */
    public void reset() {
        synchronized (lock) {
            transitionTo(CircuitState.CLOSED);
            consecutiveFailures = 0;
            consecutiveSuccesses = 0;
            halfOpenAdmitted = 0;
        }
        log.info("Circuit '{}' manually reset", name);
    }

    public CircuitBreakerStatus getStatus() {
        synchronized (lock) {
            Instant now = clock.instant();
            long finished = totalSuccesses + totalFailures;
            return CircuitBreakerStatus.builder()
                    .name(name)
                    .state(state)
                    .canProceed(canProceedLocked(now))
                    .consecutiveFailures(consecutiveFailures)
                    .consecutiveSuccesses(consecutiveSuccesses)
                    .totalCalls(totalCalls)
                    .totalSuccesses(totalSuccesses)
                    .totalFailures(totalFailures)
                    .totalRejected(totalRejected)
                    .stateChanges(stateChanges)
                    .successRatePct(finished == 0 ? 100d : (double) totalSuccesses / finished * 100d)
                    .timeUntilRetrySeconds(state == CircuitState.OPEN ? retryAfterSeconds(now) : 0d)
                    .lastFailureAt(lastFailureAt)
                    .lastSuccessAt(lastSuccessAt)
                    .config(config)
                    .recentErrors(new ArrayList<>(recentErrors))
                    .build();
        }
    }

    /**
     * @return the generation of the HalfOpen period this call probes, or -1 for an ordinary call
     */
    private long acquirePermission() {
        synchronized (lock) {
            totalCalls++;
            Instant now = clock.instant();
            if (state == CircuitState.OPEN) {
                if (!openTimeoutElapsed(now)) {
                    totalRejected++;
                    throw new CircuitOpenException(name, retryAfterSeconds(now));
                }
                transitionTo(CircuitState.HALF_OPEN);
            }
            if (state == CircuitState.HALF_OPEN) {
                if (halfOpenAdmitted >= config.getHalfOpenMaxProbes()) {
                    totalRejected++;
                    throw new CircuitOpenException(name, 0d);
                }
                halfOpenAdmitted++;
                return generation;
            }
            return -1L;
        }
    }

    private void onSuccess(long probeOf) {
        synchronized (lock) {
            totalSuccesses++;
            lastSuccessAt = clock.instant();
            consecutiveFailures = 0;
            // late successes from calls admitted while Closed, or by an earlier HalfOpen, prove nothing
            if (state == CircuitState.HALF_OPEN && probeOf == generation) {
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= config.getSuccessThreshold()) {
                    transitionTo(CircuitState.CLOSED);
                    consecutiveSuccesses = 0;
                }
            }
        }
    }

    private void onFailure(String type, String message) {
        synchronized (lock) {
            Instant now = clock.instant();
            totalFailures++;
            consecutiveSuccesses = 0;
            if (recentErrors.size() == RECENT_ERRORS) recentErrors.removeFirst();
            recentErrors.addLast(new CircuitBreakerStatus.RecentError(now, type, message));

            switch (state) {
                case CLOSED -> {
                    consecutiveFailures++;
                    lastFailureAt = now;
                    if (consecutiveFailures >= config.getFailureThreshold()) {
                        log.error("Circuit '{}' opening after {} consecutive failures (last: {})",
                                name, consecutiveFailures, message);
                        transitionTo(CircuitState.OPEN);
                    }
                }
                case HALF_OPEN -> {
                    lastFailureAt = now;
                    log.warn("Circuit '{}' probe failed, reopening: {}", name, message);
                    transitionTo(CircuitState.OPEN);
                }
                // a call admitted before the breaker opened finished late; the open clock keeps running
                case OPEN -> log.debug("Circuit '{}' late failure while open: {}", name, message);
            }
        }
    }

    private void transitionTo(CircuitState next) {
        if (state == next) return;
        CircuitState previous = state;
        state = next;
        stateChanges++;
        generation++;
        halfOpenAdmitted = 0;
        if (next == CircuitState.HALF_OPEN) consecutiveSuccesses = 0;
        if (next == CircuitState.CLOSED) consecutiveFailures = 0;
        log.info("Circuit '{}' {} -> {}", name, previous, next);
    }

    private boolean canProceedLocked(Instant now) {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> openTimeoutElapsed(now);
            case HALF_OPEN -> halfOpenAdmitted < config.getHalfOpenMaxProbes();
        };
    }

    private boolean openTimeoutElapsed(Instant now) {
        return lastFailureAt == null || !Duration.between(lastFailureAt, now).minus(config.getOpenTimeout()).isNegative();
    }

    private double retryAfterSeconds(Instant now) {
        if (lastFailureAt == null) return 0d;
        Duration remaining = config.getOpenTimeout().minus(Duration.between(lastFailureAt, now));
        return remaining.isNegative() ? 0d : remaining.toNanos() / NANOS_PER_SECOND;
    }
}
