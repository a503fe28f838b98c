package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/**
 * Connection failure or 5xx answer from the backend instance.
 * {@link #getUpstreamStatus()} is 0 when no response was received.
 */
public class BackendErrorException extends GatewayException {

    private final int upstreamStatus;

    public BackendErrorException(String message, int upstreamStatus) {
        super(HttpStatus.BAD_GATEWAY, message);
        this.upstreamStatus = upstreamStatus;
    }

    public BackendErrorException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
        this.upstreamStatus = 0;
    }

    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    @Override
    public String reason() {
        return "backend_error";
    }
}
