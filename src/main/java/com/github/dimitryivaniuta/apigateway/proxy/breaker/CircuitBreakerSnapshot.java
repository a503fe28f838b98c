package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import java.time.Instant;

/**
 * Point-in-time view of one breaker. Call counts cover the breaker's current window and are cleared
 * when it closes; {@code openedAt} is null until the breaker first opens.
 */
public record CircuitBreakerSnapshot(String service,
                                     CircuitState state,
                                     int failedCalls,
                                     int successfulCalls,
                                     long notPermittedCalls,
                                     Instant openedAt,
                                     boolean trialInFlight) {}
