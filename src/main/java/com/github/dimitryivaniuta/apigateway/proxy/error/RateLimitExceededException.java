package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/** Too many requests for the client's tier in the current window. */
public class RateLimitExceededException extends GatewayException {

    private final Duration retryAfter;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(HttpStatus.TOO_MANY_REQUESTS, message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /** Whole seconds for the Retry-After header, rounded up, never below 1. */
    public long getRetryAfterSeconds() {
        return RetryAfter.seconds(retryAfter);
    }

    @Override
    public String reason() {
        return "too_many_requests";
    }
}
