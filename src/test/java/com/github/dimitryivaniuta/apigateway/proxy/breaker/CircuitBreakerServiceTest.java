package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.apigateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerServiceTest {

    private static final String ORDERS = "orders";

    private MutableClock clock;
    private SimpleMeterRegistry meters;
    private CircuitBreakerService registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        meters = new SimpleMeterRegistry();
        registry = registry(5);
    }

    private CircuitBreakerService registry(int threshold) {
        GatewayProperties props = new GatewayProperties();
        props.getCircuitBreaker().setFailureThreshold(threshold);
        props.getCircuitBreaker().setRecoveryTimeout(Duration.ofSeconds(60));
        props.getServices().put(ORDERS, new GatewayProperties.Service());
        return new CircuitBreakerService(props, clock, new GatewayMetrics(meters));
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            CallPermit p = registry.tryAcquire(ORDERS).orElseThrow();
            registry.recordFailure(p, new IllegalStateException("boom"));
        }
    }

    @Test
    void configuredServices_shouldHaveClosedBreakersFromStart() {
        assertThat(registry.snapshots()).containsKey(ORDERS);
        assertThat(registry.snapshot(ORDERS).state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void fiveConsecutiveFailures_shouldOpenAndFailFastUntilRecoveryTimeout() {
        fail(5);

        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.state()).isEqualTo(CircuitState.OPEN);
        assertThat(s.openedAt()).isEqualTo(clock.instant());
        assertThat(registry.tryAcquire(ORDERS)).isEmpty();
        assertThat(registry.retryAfter(ORDERS)).contains(Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(59));
        assertThat(registry.allowRequest(ORDERS)).isFalse();
        assertThat(registry.retryAfter(ORDERS)).contains(Duration.ofSeconds(1));

        clock.advance(Duration.ofSeconds(1));
        Optional<CallPermit> trial = registry.tryAcquire(ORDERS);
        assertThat(trial).isPresent();
        assertThat(trial.get().trial()).isTrue();
        assertThat(registry.snapshot(ORDERS).state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(registry.snapshot(ORDERS).trialInFlight()).isTrue();
    }

    @Test
    void halfOpen_shouldRejectOthersWhileTrialInFlight() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));

        assertThat(registry.tryAcquire(ORDERS)).isPresent();
        assertThat(registry.tryAcquire(ORDERS)).isEmpty();
        assertThat(registry.tryAcquire(ORDERS)).isEmpty();
    }

    @Test
    void successfulTrial_shouldCloseAndResetFailures() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        CallPermit trial = registry.tryAcquire(ORDERS).orElseThrow();

        registry.recordSuccess(trial);

        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(s.failedCalls()).isZero();
        assertThat(s.trialInFlight()).isFalse();
        assertThat(registry.tryAcquire(ORDERS)).isPresent();
    }

    @Test
    void failedTrial_shouldReopenWithFreshOpenedAt() {
        fail(5);
        Instant firstOpen = clock.instant();
        clock.advance(Duration.ofSeconds(75));
        CallPermit trial = registry.tryAcquire(ORDERS).orElseThrow();

        registry.recordFailure(trial, new IllegalStateException("still down"));

        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.state()).isEqualTo(CircuitState.OPEN);
        assertThat(s.openedAt()).isEqualTo(firstOpen.plusSeconds(75));
        assertThat(registry.tryAcquire(ORDERS)).isEmpty();

        clock.advance(Duration.ofSeconds(60));
        assertThat(registry.tryAcquire(ORDERS)).isPresent();
    }

    @Test
    void successInClosed_shouldBreakTheFailureRun() {
        fail(4);
        assertThat(registry.snapshot(ORDERS).failedCalls()).isEqualTo(4);

        registry.recordSuccess(registry.tryAcquire(ORDERS).orElseThrow());
        assertThat(registry.snapshot(ORDERS).successfulCalls()).isEqualTo(1);

        fail(4);
        assertThat(registry.snapshot(ORDERS).state()).isEqualTo(CircuitState.CLOSED);

        fail(1);
        assertThat(registry.snapshot(ORDERS).state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void lateOutcomeFromEarlierEpoch_shouldNotSettleHalfOpenTrial() {
        CallPermit slow = registry.tryAcquire(ORDERS).orElseThrow();
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        registry.tryAcquire(ORDERS).orElseThrow(); // the trial

        registry.recordSuccess(slow);

        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.state()).isEqualTo(CircuitState.HALF_OPEN);
        assertThat(s.trialInFlight()).isTrue();
    }

    @Test
    void lateFailureWhileOpen_shouldNotMoveOpenedAt() {
        CallPermit slow = registry.tryAcquire(ORDERS).orElseThrow();
        fail(5);
        Instant openedAt = registry.snapshot(ORDERS).openedAt();
        clock.advance(Duration.ofSeconds(30));

        registry.recordFailure(slow, new IllegalStateException("late"));

        assertThat(registry.snapshot(ORDERS).openedAt()).isEqualTo(openedAt);
    }

    @Test
    void concurrentRequestsInHalfOpen_shouldGetExactlyOneTrial() throws Exception {
        fail(5);
        clock.advance(Duration.ofSeconds(60));

        int threads = 32;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return registry.tryAcquire(ORDERS).isPresent();
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(10, TimeUnit.SECONDS)) granted++;
            }
            assertThat(granted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void concurrentOutcomes_shouldNotLoseUpdates() throws Exception {
        registry = registry(10_000);
        int threads = 8;
        int perThread = 500;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.recordOutcome(ORDERS, false);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.failedCalls()).isEqualTo(threads * perThread);
        assertThat(s.state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void unrelatedServices_shouldNotAffectEachOther() {
        fail(5);
        assertThat(registry.tryAcquire("users")).isPresent();
        assertThat(registry.snapshot("users").state()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void transitionsAndRejections_shouldBeCounted() {
        fail(5);
        registry.tryAcquire(ORDERS);

        assertThat(meters.get("gateway_breaker_transitions_total")
                .tags("service", ORDERS, "from", "closed", "to", "open").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("gateway_breaker_rejected_total")
                .tag("service", ORDERS).counter().count()).isEqualTo(1.0);
    }

    @Test
    void rejectedRequestsWhileOpen_shouldNotCountAsFailures() {
        fail(5);
        registry.tryAcquire(ORDERS);
        registry.tryAcquire(ORDERS);

        assertThat(registry.snapshot(ORDERS).failedCalls()).isEqualTo(5);
    }

    @Test
    void recoveryTimeout_shouldFollowInjectedClockNotWallTime() {
        fail(5);
        clock.advance(Duration.ofMinutes(10));

        assertThat(registry.retryAfter(ORDERS)).contains(Duration.ZERO);
        assertThat(registry.tryAcquire(ORDERS)).isPresent();
    }

    @Test
    void reset_shouldCloseEveryBreaker() {
        fail(5);
        registry.reset();
        CircuitBreakerSnapshot s = registry.snapshot(ORDERS);
        assertThat(s.state()).isEqualTo(CircuitState.CLOSED);
        assertThat(s.openedAt()).isNull();
        assertThat(s.failedCalls()).isZero();
        assertThat(registry.tryAcquire(ORDERS)).isPresent();
    }
}
