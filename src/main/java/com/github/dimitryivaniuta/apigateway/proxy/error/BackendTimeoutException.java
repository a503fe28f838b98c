package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

public class BackendTimeoutException extends GatewayException {

    public BackendTimeoutException(String message, Throwable cause) {
        super(HttpStatus.GATEWAY_TIMEOUT, message, cause);
    }

    @Override
    public String reason() {
        return "backend_timeout";
    }
}
