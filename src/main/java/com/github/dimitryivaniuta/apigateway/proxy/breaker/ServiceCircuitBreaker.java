package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import com.github.dimitryivaniuta.apigateway.proxy.time.TimeWindow;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Gateway view of the Resilience4j breaker of one backend service.
 *
 * <p>Resilience4j owns the state machine and the call window. This class adds what the gateway
 * needs on top of it:
 * <ul>
 *   <li>OPEN moves to HALF_OPEN against the injected clock, on the first request once
 *       {@code now - openedAt >= recovery}.</li>
 *   <li>Every transition starts a new epoch, and a permit only settles the epoch it was issued in,
 *       so a slow call admitted while CLOSED cannot decide a later half-open trial.</li>
 * </ul>
 * Acquire, record and transition run under this object's monitor; different services never contend.
 */
class ServiceCircuitBreaker {

    private final String service;
    private final CircuitBreaker breaker;
    private final TimeWindow recovery;
    private final Clock clock;

    private Instant openedAt;
    private boolean trialInFlight;
    private long epoch;

    ServiceCircuitBreaker(CircuitBreaker breaker,
                          Duration recoveryTimeout,
                          Clock clock,
                          CircuitTransitionListener listener) {
        this.service = breaker.getName();
        this.breaker = breaker;
        this.recovery = TimeWindow.of(recoveryTimeout);
        this.clock = clock;

        breaker.getEventPublisher()
                .onStateTransition(event -> {
                    CircuitBreaker.StateTransition t = event.getStateTransition();
                    epoch++;
                    trialInFlight = false;
                    if (t.getToState() == CircuitBreaker.State.OPEN) {
                        openedAt = clock.instant();
                    }
                    CircuitState from = CircuitState.of(t.getFromState());
                    CircuitState to = CircuitState.of(t.getToState());
                    if (from != to) {
                        listener.onTransition(service, from, to);
                    }
                })
                .onReset(event -> {
                    epoch++;
                    trialInFlight = false;
                    openedAt = null;
                });
    }

    synchronized Optional<CallPermit> tryAcquire() {
        if (breaker.getState() == CircuitBreaker.State.OPEN) {
            if (!recovery.hasElapsed(openedAt, clock.instant())) {
                return Optional.empty();
            }
            breaker.transitionToHalfOpenState();
        }
        if (!breaker.tryAcquirePermission()) {
            return Optional.empty();
        }
        boolean trial = breaker.getState() == CircuitBreaker.State.HALF_OPEN;
        if (trial) {
            trialInFlight = true;
        }
        return Optional.of(new CallPermit(service, epoch, trial, System.nanoTime()));
    }

    /**
     * @param failure null for a success
     * @return false if the permit belonged to an earlier epoch and was ignored
     */
    synchronized boolean record(CallPermit permit, Throwable failure) {
        if (permit.epoch() != epoch) {
            return false;
        }
        apply(System.nanoTime() - permit.startedNanos(), failure);
        return true;
    }

    /** Records against the current state, for callers that do not hold a permit. */
    synchronized void record(Throwable failure) {
        apply(0, failure);
    }

    private void apply(long nanos, Throwable failure) {
        if (failure == null) {
            breaker.onSuccess(nanos, TimeUnit.NANOSECONDS);
        } else {
            breaker.onError(nanos, TimeUnit.NANOSECONDS, failure);
        }
    }

    /** Remaining open time; empty unless OPEN. */
    synchronized Optional<Duration> remainingOpenTime() {
        if (breaker.getState() != CircuitBreaker.State.OPEN || openedAt == null) return Optional.empty();
        Duration left = Duration.between(clock.instant(), openedAt.plus(recovery.length()));
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    synchronized CircuitBreakerSnapshot snapshot() {
        CircuitBreaker.Metrics m = breaker.getMetrics();
        return new CircuitBreakerSnapshot(service,
                CircuitState.of(breaker.getState()),
                m.getNumberOfFailedCalls(),
                m.getNumberOfSuccessfulCalls(),
                m.getNumberOfNotPermittedCalls(),
                openedAt,
                trialInFlight);
    }

    synchronized void reset() {
        breaker.reset();
    }
}
