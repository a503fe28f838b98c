package com.github.dimitryivaniuta.apigateway.proxy.error;

import org.springframework.http.HttpStatus;

/** No configured backend service matches the request. */
public class RouteNotFoundException extends GatewayException {

    public RouteNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }

    @Override
    public String reason() {
        return "route_not_found";
    }
}
