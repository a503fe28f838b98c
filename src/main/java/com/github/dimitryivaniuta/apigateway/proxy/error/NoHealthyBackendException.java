package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/** The service has no configured instance to forward to. */
public class NoHealthyBackendException extends GatewayException {

    public NoHealthyBackendException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    @Override
    public String reason() {
        return "no_healthy_backend";
    }
}
