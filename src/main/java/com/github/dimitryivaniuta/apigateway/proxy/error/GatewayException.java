package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/**
 * Base of every failure the gateway reports to its caller instead of a relayed backend response.
 *
 * <p>Admission failures are raised before any backend is contacted; backend failures after the
 * outcome has been recorded into the circuit breaker.
 */
public abstract class GatewayException extends RuntimeException {

    private final HttpStatus status;

    protected GatewayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected GatewayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    /** Short machine-readable reason, used as a metrics tag. */
    public abstract String reason();
}
