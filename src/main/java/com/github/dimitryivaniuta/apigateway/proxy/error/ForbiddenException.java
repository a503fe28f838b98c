package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/** Source address or origin not allowed, or the principal lacks the route's role. */
public class ForbiddenException extends GatewayException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }

    @Override
    public String reason() {
        return "forbidden";
    }
}
