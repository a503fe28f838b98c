package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.metrics.GatewayMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One breaker per backend service name, backed by a Resilience4j {@link CircuitBreakerRegistry}.
 *
 * <p>The Resilience4j configuration turns its failure-rate breaker into a consecutive-failure one:
 * <ul>
 *   <li>count-based window of {@code failure-threshold} calls, evaluated once full, opening at a
 *       100% failure rate, i.e. after {@code failure-threshold} failures in a row</li>
 *   <li>one permitted call in HALF_OPEN, whose outcome closes or reopens the breaker</li>
 *   <li>no automatic OPEN to HALF_OPEN timer; {@link ServiceCircuitBreaker} moves it on the next request</li>
 * </ul>
 * Breakers of configured services exist from start-up; any other name gets a breaker on first use.
 * State is local to this gateway process.
 */
@Slf4j
@Service
public class CircuitBreakerService {

    private final CircuitBreakerRegistry registry;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final GatewayMetrics metrics;

    private final Map<String, ServiceCircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerService(GatewayProperties props, Clock clock, GatewayMetrics metrics) {
        this.registry = CircuitBreakerRegistry.of(configFor(props));
        this.recoveryTimeout = props.getCircuitBreaker().getRecoveryTimeout();
        this.clock = clock;
        this.metrics = metrics;
        props.getServices().keySet().forEach(this::breaker);
    }

    static CircuitBreakerConfig configFor(GatewayProperties props) {
        int threshold = props.getCircuitBreaker().getFailureThreshold();
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(props.getCircuitBreaker().getRecoveryTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                // slow successes never count against a service; timeouts are recorded as failures
                .slowCallRateThreshold(100)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .build();
    }

    /**
     * Asks to attempt a call against {@code service}.
     *
     * @return a permit to be settled with {@link #recordSuccess} or {@link #recordFailure}, or empty to fail fast
     */
    public Optional<CallPermit> tryAcquire(String service) {
        Optional<CallPermit> permit = breaker(service).tryAcquire();
        if (permit.isEmpty()) {
            metrics.breakerRejected(service);
        }
        return permit;
    }

    public void recordSuccess(CallPermit permit) {
        settle(permit, null);
    }

    public void recordFailure(CallPermit permit, Throwable cause) {
        settle(permit, cause);
    }

    private void settle(CallPermit permit, Throwable failure) {
        if (!breaker(permit.service()).record(permit, failure)) {
            log.debug("Late outcome ignored: service={}, epoch={}, success={}", permit.service(), permit.epoch(), failure == null);
        }
    }

    /** Permit-less form of {@link #tryAcquire(String)}; a granted half-open trial must still be recorded. */
    public boolean allowRequest(String service) {
        return tryAcquire(service).isPresent();
    }

    /** Permit-less outcome, applied to the breaker's current state. */
    public void recordOutcome(String service, boolean success) {
        breaker(service).record(success ? null : new IllegalStateException("Failure reported for service " + service));
    }

    /** Time until an OPEN breaker admits its trial; empty if not OPEN. */
    public Optional<Duration> retryAfter(String service) {
        return breaker(service).remainingOpenTime();
    }

    public CircuitBreakerSnapshot snapshot(String service) {
        return breaker(service).snapshot();
    }

    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> out = new TreeMap<>();
        breakers.forEach((name, b) -> out.put(name, b.snapshot()));
        return out;
    }

    /** Closes every breaker. */
    public void reset() {
        breakers.values().forEach(ServiceCircuitBreaker::reset);
    }

    private ServiceCircuitBreaker breaker(String service) {
        return breakers.computeIfAbsent(service, name ->
                new ServiceCircuitBreaker(registry.circuitBreaker(name), recoveryTimeout, clock, this::onTransition));
    }

    private void onTransition(String service, CircuitState from, CircuitState to) {
        if (to == CircuitState.OPEN) {
            log.warn("Circuit breaker opened: service={}, from={}", service, from.tag());
        } else {
            log.info("Circuit breaker transition: service={}, {} -> {}", service, from.tag(), to.tag());
        }
        metrics.breakerTransition(service, from.tag(), to.tag());
    }
}
