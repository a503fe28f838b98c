package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

public enum CircuitState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half_open");

    private final String tag;

    CircuitState(String tag) { this.tag = tag; }

    public String tag() { return tag; }

    static CircuitState of(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
