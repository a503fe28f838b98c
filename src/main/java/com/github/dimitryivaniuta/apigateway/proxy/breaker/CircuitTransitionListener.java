package com.github.dimitryivaniuta.apigateway.proxy.breaker;

@FunctionalInterface
public interface CircuitTransitionListener {

    /** Called on the thread that caused the transition, under the service breaker's lock; must not block. */
    void onTransition(String service, CircuitState from, CircuitState to);
}
