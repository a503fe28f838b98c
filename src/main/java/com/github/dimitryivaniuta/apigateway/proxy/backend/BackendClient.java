package com.github.dimitryivaniuta.apigateway.proxy.backend;

import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Network seam to the backend services.
 *
 * <p>The returned future completes with whatever the instance answered, any status included, or
 * exceptionally with a {@link java.util.concurrent.TimeoutException} when the configured bound is
 * exceeded, or with the I/O failure of the call. Implementations must not retry.
 */
public interface BackendClient {

    CompletableFuture<GatewayResponse> forward(BackendRequest request);
}
