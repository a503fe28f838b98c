package com.github.dimitryivaniuta.apigateway.proxy.breaker;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.stereotype.Component;

import java.util.Map;

/** {@code /actuator/circuitbreakers}: read-only breaker state per service. */
@Component
@Endpoint(id = "circuitbreakers")
@RequiredArgsConstructor
public class CircuitBreakerEndpoint {

    private final CircuitBreakerService breakers;

    @ReadOperation
    public Map<String, CircuitBreakerSnapshot> breakers() {
        return breakers.snapshots();
    }

    @ReadOperation
    public CircuitBreakerSnapshot breaker(@Selector String service) {
        // null -> 404, without creating a breaker for an unknown name
        return breakers.snapshots().get(service);
    }
}
