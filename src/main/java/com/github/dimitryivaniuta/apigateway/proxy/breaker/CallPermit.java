package com.github.dimitryivaniuta.apigateway.proxy.breaker;

/**
 * Admission ticket for one backend attempt. Must be settled exactly once through
 * {@link CircuitBreakerService#recordSuccess(CallPermit)} or
 * {@link CircuitBreakerService#recordFailure(CallPermit, Throwable)}.
 *
 * @param service      breaker the permit was taken from
 * @param epoch        breaker generation at admission; outcomes from an older generation are ignored
 * @param trial        whether this is the single half-open trial
 * @param startedNanos {@link System#nanoTime()} at admission, for the recorded call duration
 */
public record CallPermit(String service, long epoch, boolean trial, long startedNanos) {}
