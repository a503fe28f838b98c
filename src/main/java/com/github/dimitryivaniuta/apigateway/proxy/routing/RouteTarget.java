package com.github.dimitryivaniuta.apigateway.proxy.routing;

import java.util.List;

/** Resolved backend service and its ordered instance base URLs. */
public record RouteTarget(String service, List<String> instances) {

    public RouteTarget {
        instances = List.copyOf(instances);
    }
}
