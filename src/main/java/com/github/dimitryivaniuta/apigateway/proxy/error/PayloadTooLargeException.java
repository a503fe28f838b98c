package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

public class PayloadTooLargeException extends GatewayException {

    public PayloadTooLargeException(String message) {
        super(HttpStatus.PAYLOAD_TOO_LARGE, message);
    }

    @Override
    public String reason() {
        return "payload_too_large";
    }
}
