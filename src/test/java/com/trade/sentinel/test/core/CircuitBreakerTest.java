package com.trade.sentinel.test.core;

import com.trade.sentinel.common.Result;
import com.trade.sentinel.common.exception.CircuitOpenException;
import com.trade.sentinel.common.exception.ConfigurationException;
import com.trade.sentinel.core.breaker.CircuitBreaker;
import com.trade.sentinel.core.breaker.CircuitBreakerConfig;
import com.trade.sentinel.core.breaker.CircuitBreakerRegistry;
import com.trade.sentinel.core.breaker.CircuitBreakerStatus;
import com.trade.sentinel.core.breaker.CircuitState;
import com.trade.sentinel.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        CircuitBreakerConfig config = CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .successThreshold(2)
                .openTimeout(Duration.ofSeconds(30))
                .halfOpenMaxProbes(2)
                .build();
        breaker = new CircuitBreaker("venue", config, clock);
    }

    private void fail() {
        try {
            breaker.call(() -> {
                throw new IllegalStateException("venue down");
            });
        } catch (IllegalStateException expected) {
            // counted by the breaker
        }
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) fail();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void staysClosedBelowThresholdAndSuccessResetsCount() {
        fail();
        fail();
        assertThat(breaker.call(() -> "ok")).isEqualTo("ok");
        fail();
        fail();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.getStatus().getConsecutiveFailures()).isEqualTo(2);
    }

    @Test
    void opensAfterThresholdAndRejectsWithoutInvoking() {
        tripOpen();
        AtomicInteger invoked = new AtomicInteger();

        clock.advance(Duration.ofSeconds(10));

        assertThatThrownBy(() -> breaker.call(invoked::incrementAndGet))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(ex -> {
                    CircuitOpenException coe = (CircuitOpenException) ex;
                    assertThat(coe.getDependencyName()).isEqualTo("venue");
                    assertThat(coe.getRetryAfterSeconds()).isCloseTo(20.0, within(1e-6));
                });
        assertThat(invoked.get()).isZero();
        assertThat(breaker.getStatus().getTotalRejected()).isEqualTo(1);
    }

    @Test
    void originalExceptionIsRethrownUnchanged() {
        IllegalArgumentException boom = new IllegalArgumentException("bad order");

        assertThatThrownBy(() -> breaker.call(() -> {
            throw boom;
        })).isSameAs(boom);
    }

    @Test
    void recoversThroughHalfOpenAfterTimeout() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.call(() -> 1)).isEqualTo(1);
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.call(() -> 2)).isEqualTo(2);

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        CircuitBreakerStatus status = breaker.getStatus();
        assertThat(status.getConsecutiveFailures()).isZero();
        assertThat(status.getStateChanges()).isEqualTo(3);
    }

    @Test
    void failureInHalfOpenReopensAndRestartsTheClock() {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        fail();
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(() -> breaker.call(() -> "x")).isInstanceOf(CircuitOpenException.class);
        clock.advance(Duration.ofSeconds(1));
        assertThat(breaker.call(() -> "x")).isEqualTo("x");
    }

    @Test
    void halfOpenAdmitsAtMostTheConfiguredProbes() throws Exception {
        tripOpen();
        clock.advance(Duration.ofSeconds(30));

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(2);
        Runnable slowProbe = () -> breaker.call(() -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "probe";
        });
        Thread p1 = new Thread(slowProbe);
        Thread p2 = new Thread(slowProbe);
        p1.start();
        p2.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> breaker.call(() -> "third"))
                .isInstanceOf(CircuitOpenException.class)
                .satisfies(ex -> assertThat(((CircuitOpenException) ex).getRetryAfterSeconds()).isZero());

        release.countDown();
        p1.join(5_000);
        p2.join(5_000);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void concurrentFailuresCrossingTheThresholdOpenExactlyOnce() throws Exception {
        int callers = 8;
        CountDownLatch admitted = new CountDownLatch(callers);
        CountDownLatch release = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Thread t = new Thread(() -> {
                try {
                    breaker.call(() -> {
                        admitted.countDown();
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        throw new IllegalStateException("venue down");
                    });
                } catch (IllegalStateException expected) {
                    // every caller sees its own failure
                }
            });
            threads.add(t);
            t.start();
        }
        assertThat(admitted.await(5, TimeUnit.SECONDS)).isTrue();

        release.countDown();
        for (Thread t : threads) t.join(5_000);

        CircuitBreakerStatus status = breaker.getStatus();
        assertThat(status.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(status.getStateChanges()).isEqualTo(1);
        assertThat(status.getTotalFailures()).isEqualTo(callers);
    }

    @Test
    void lateSuccessFromAClosedCallDoesNotCloseTheBreaker() throws Exception {
        CountDownLatch admitted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread straggler = new Thread(() -> breaker.call(() -> {
            admitted.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "filled";
        }));
        straggler.start();
        assertThat(admitted.await(5, TimeUnit.SECONDS)).isTrue();

        tripOpen();
        clock.advance(Duration.ofSeconds(30));
        assertThat(breaker.call(() -> "probe")).isEqualTo("probe");
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        release.countDown();
        straggler.join(5_000);

        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(breaker.getStatus().getConsecutiveSuccesses()).isEqualTo(1);
        assertThat(breaker.getStatus().getTotalSuccesses()).isEqualTo(2);
    }

    @Test
    void failedResultCountsAsFailureButIsReturned() {
        for (int i = 0; i < 3; i++) {
            Result<String> r = breaker.call(() -> Result.fail("ERR-VENUE", "rejected by venue"));
            assertThat(r.isFailure()).isTrue();
        }

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.getStatus().getRecentErrors())
                .extracting(CircuitBreakerStatus.RecentError::message)
                .containsOnly("rejected by venue");
    }

    @Test
    void recentErrorsAreBounded() {
        CircuitBreaker tolerant = new CircuitBreaker("tolerant",
                CircuitBreakerConfig.builder().failureThreshold(100).build(), clock);
        for (int i = 0; i < 15; i++) {
            int n = i;
            try {
                tolerant.call(() -> {
                    throw new IllegalStateException("e" + n);
                });
            } catch (IllegalStateException expected) {
                // counted
            }
        }

        assertThat(tolerant.getStatus().getRecentErrors()).hasSize(10);
        assertThat(tolerant.getStatus().getRecentErrors().get(9).message()).isEqualTo("e14");
    }

    @Test
    void manualResetCloses() {
        tripOpen();

        breaker.reset();

        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.canProceed()).isTrue();
    }

    @Test
    void successThresholdAboveProbesIsRejected() {
        CircuitBreakerConfig bad = CircuitBreakerConfig.builder().successThreshold(4).halfOpenMaxProbes(3).build();

        assertThatThrownBy(() -> new CircuitBreaker("bad", bad, clock))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("success-threshold");
    }

    @Test
    void registryHandsOutOneBreakerPerNameWithOverrides() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(
                CircuitBreakerConfig.defaults(),
                Map.of("feed", CircuitBreakerConfig.builder().failureThreshold(1).build()),
                clock);

        assertThat(registry.get("venue")).isSameAs(registry.get("venue"));
        assertThat(registry.get("venue").getStatus().getConfig().getFailureThreshold()).isEqualTo(5);
        assertThat(registry.get("feed").getStatus().getConfig().getFailureThreshold()).isEqualTo(1);
        assertThat(registry.names()).containsExactly("feed", "venue");

        try {
            registry.get("feed").call(() -> {
                throw new IllegalStateException("down");
            });
        } catch (IllegalStateException expected) {
            // counted
        }
        assertThat(registry.getAllStatus().get("feed").getState()).isEqualTo(CircuitState.OPEN);

        registry.resetAll();
        assertThat(registry.get("feed").getState()).isEqualTo(CircuitState.CLOSED);
    }
}
