package com.github.dimitryivaniuta.apigateway.proxy.balancer;

import com.github.dimitryivaniuta.apigateway.proxy.error.NoHealthyBackendException;

import java.util.List;

public interface BackendSelector {

    /**
     * Picks the instance for the next request to {@code service}.
     *
     * @throws NoHealthyBackendException if {@code instances} is empty
     */
    String select(String service, List<String> instances);
}
