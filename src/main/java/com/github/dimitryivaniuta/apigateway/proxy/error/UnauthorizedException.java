package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/** Missing, malformed, expired, revoked or unverifiable credential. */
public class UnauthorizedException extends GatewayException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, message, cause);
    }

    @Override
    public String reason() {
        return "unauthorized";
    }
}
