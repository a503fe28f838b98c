package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

import java.time.Duration;
import java.util.Optional;

/** The service's circuit breaker refused the call. */
public class ServiceUnavailableException extends GatewayException {

    private final Duration retryAfter;

    public ServiceUnavailableException(String message, Duration retryAfter) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
        this.retryAfter = retryAfter;
    }

    /** Remaining open time, empty while a half-open trial is in flight. */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String reason() {
        return "service_unavailable";
    }
}
