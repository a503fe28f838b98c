package com.github.dimitryivaniuta.apigateway.proxy.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Admission ----
    public void admissionRejected(String reason) {
        Counter.builder("gateway_admission_rejected_total")
                .tag("reason", reason) // forbidden | payload_too_large | unauthorized | too_many_requests ...
                .register(registry)
                .increment();
    }

    // ---- Rate limiting ----
    public void rateLimitAllowed(String tier) {
        Counter.builder("gateway_ratelimit_allowed_total")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void rateLimitRejected(String tier) {
        Counter.builder("gateway_ratelimit_rejected_total")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    // ---- Cache ----
    public void cacheHit() {
        Counter.builder("gateway_cache_hits_total")
                .register(registry)
                .increment();
    }

    public void cacheMiss() {
        Counter.builder("gateway_cache_misses_total")
                .register(registry)
                .increment();
    }

    // ---- Circuit breaker ----
    public void breakerRejected(String service) {
        Counter.builder("gateway_breaker_rejected_total")
                .tag("service", service)
                .register(registry)
                .increment();
    }

    public void breakerTransition(String service, String from, String to) {
        Counter.builder("gateway_breaker_transitions_total")
                .tag("service", service)
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    // ---- Backend ----
    public void backendCall(String service, String outcome, long nanos) {
        Counter.builder("gateway_backend_calls_total")
                .tag("service", service)
                .tag("outcome", outcome) // success | error | timeout
                .register(registry)
                .increment();
        Timer.builder("gateway_backend_duration_seconds")
                .tag("service", service)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }
}
