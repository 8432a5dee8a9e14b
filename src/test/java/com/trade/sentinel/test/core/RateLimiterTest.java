package com.trade.sentinel.test.core;

import com.trade.sentinel.common.exception.ConfigurationException;
import com.trade.sentinel.common.exception.RateLimitExceededException;
import com.trade.sentinel.core.ratelimit.RateLimit;
import com.trade.sentinel.core.ratelimit.RateLimitDecision;
import com.trade.sentinel.core.ratelimit.RateLimiter;
import com.trade.sentinel.core.ratelimit.RateLimiterStatus;
import com.trade.sentinel.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock();

    @Test
    void twoPerSecondAdmitsTwoThenReportsWaitWithinOneSecond() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.of("per-second", 2, 1)), clock);

        assertThat(limiter.tryAcquire(1).allowed()).isTrue();
        assertThat(limiter.tryAcquire(1).allowed()).isTrue();

        RateLimitDecision third = limiter.tryAcquire(1);
        assertThat(third.allowed()).isFalse();
        assertThat(third.waitSeconds()).isGreaterThan(0).isLessThanOrEqualTo(1.0);
        assertThat(third.limitName()).isEqualTo("per-second");
    }

    @Test
    void waitIsTheMaximumAcrossBuckets() {
        RateLimiter limiter = new RateLimiter(List.of(
                RateLimit.of("per-second", 10, 1),
                RateLimit.of("per-minute", 1, 60)), clock);

        assertThat(limiter.tryAcquire(1).allowed()).isTrue();

        RateLimitDecision blocked = limiter.tryAcquire(1);
        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.limitName()).isEqualTo("per-minute");
        assertThat(blocked.waitSeconds()).isCloseTo(60.0, within(1e-6));
    }

    @Test
    void rejectedAttemptLeavesNoPartialConsumption() {
        RateLimiter limiter = new RateLimiter(List.of(
                RateLimit.of("per-second", 5, 1),
                RateLimit.of("per-hour", 1, 3600)), clock);
        limiter.tryAcquire(1);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire(1).allowed()).isFalse();
        }

        RateLimiterStatus status = limiter.getStatus();
        RateLimiterStatus.BucketStatus perSecond = status.buckets().get(0);
        assertThat(perSecond.name()).isEqualTo("per-second");
        assertThat(perSecond.available()).isCloseTo(4.0, within(1e-9));
        assertThat(status.totalAdmitted()).isEqualTo(1);
        assertThat(status.totalBlocked()).isEqualTo(3);
        assertThat(status.blockRatePct()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void weightIsChargedOnlyToWeightedBuckets() {
        RateLimiter limiter = new RateLimiter(List.of(
                RateLimit.of("per-second", 50, 1),
                RateLimit.weighted("weight-per-minute", 1200, 60)), clock);

        assertThat(limiter.tryAcquire(20).allowed()).isTrue();

        List<RateLimiterStatus.BucketStatus> buckets = limiter.getStatus().buckets();
        assertThat(buckets.get(0).available()).isCloseTo(49.0, within(1e-9));
        assertThat(buckets.get(1).available()).isCloseTo(1180.0, within(1e-9));
    }

    @Test
    void capacityReturnsAfterTheWindowElapses() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.of("per-second", 2, 1)), clock);
        limiter.tryAcquire(1);
        limiter.tryAcquire(1);
        assertThat(limiter.tryAcquire(1).allowed()).isFalse();

        clock.advanceMillis(500);

        assertThat(limiter.tryAcquire(1).allowed()).isTrue();
    }

    @Test
    void acquireWithZeroTimeoutThrowsWithRetryAfter() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.of("per-second", 1, 1)), clock);
        limiter.acquire(1, Duration.ZERO);

        assertThatThrownBy(() -> limiter.acquire(1, Duration.ZERO))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(ex -> {
                    RateLimitExceededException rle = (RateLimitExceededException) ex;
                    assertThat(rle.getLimitName()).isEqualTo("per-second");
                    assertThat(rle.getRetryAfterSeconds()).isGreaterThan(0).isLessThanOrEqualTo(1.0);
                    assertThat(rle.getErrorCode()).isEqualTo(RateLimitExceededException.DEFAULT_ERROR_CODE);
                });
    }

    @Test
    void acquireBlocksUntilCapacityRefills() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.of("per-second", 10, 1)), Clock.systemUTC());
        for (int i = 0; i < 10; i++) limiter.acquire(1, Duration.ZERO);

        long t0 = System.nanoTime();
        limiter.acquire(1, Duration.ofSeconds(2));
        long waitedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(waitedMs).isGreaterThanOrEqualTo(50).isLessThan(1_000);
    }

    @Test
    void acquireGivesUpAtTheDeadline() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.of("per-minute", 1, 60)), Clock.systemUTC());
        limiter.acquire(1, Duration.ZERO);

        long t0 = System.nanoTime();
        assertThatThrownBy(() -> limiter.acquire(1, Duration.ofMillis(250)))
                .isInstanceOf(RateLimitExceededException.class);
        long waitedMs = (System.nanoTime() - t0) / 1_000_000;

        assertThat(waitedMs).isGreaterThanOrEqualTo(200).isLessThan(2_000);
    }

    @Test
    void weightAboveWeightedCapacityIsInvalid() {
        RateLimiter limiter = new RateLimiter(List.of(RateLimit.weighted("weight", 10, 1)), clock);

        assertThatThrownBy(() -> limiter.tryAcquire(11)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.tryAcquire(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(limiter.maxWeight()).isEqualTo(10);
        assertThat(limiter.getStatus().totalRequests()).isZero();
    }

    @Test
    void concurrentCallersNeverOverdrawCapacity() throws Exception {
        RateLimiter limiter = new RateLimiter(List.of(
                RateLimit.of("per-minute", 50, 60),
                RateLimit.weighted("weight-per-minute", 120, 60)), clock);
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> done = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                done.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 20; n++) {
                        if (limiter.tryAcquire(2).allowed()) admitted.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : done) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        // weight 2 against 120 units caps admissions at 60, the 50-per-minute bucket caps them at 50
        assertThat(admitted.get()).isEqualTo(50);
        RateLimiterStatus status = limiter.getStatus();
        assertThat(status.totalAdmitted()).isEqualTo(50);
        assertThat(status.totalRequests()).isEqualTo(callers * 20L);
        assertThat(status.buckets()).allSatisfy(b -> assertThat(b.available()).isGreaterThanOrEqualTo(0d));
    }

    @Test
    void duplicateLimitNamesAreAConfigurationError() {
        assertThatThrownBy(() -> new RateLimiter(List.of(
                RateLimit.of("same", 1, 1),
                RateLimit.of("same", 2, 1)), clock))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RateLimit.of("bad", 0, 1)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void resetRefillsBucketsAndClearsCounters() {
        RateLimiter limiter = new RateLimiter(RateLimiter.defaultLimits(), clock);
        for (int i = 0; i < 50; i++) limiter.tryAcquire(1);
        assertThat(limiter.tryAcquire(1).allowed()).isFalse();

        limiter.reset();

        RateLimiterStatus status = limiter.getStatus();
        assertThat(status.totalRequests()).isZero();
        assertThat(status.buckets()).extracting(RateLimiterStatus.BucketStatus::utilizationPct)
                .allSatisfy(u -> assertThat(u).isCloseTo(0.0, within(1e-9)));
        assertThat(limiter.tryAcquire(1).allowed()).isTrue();
    }
}
