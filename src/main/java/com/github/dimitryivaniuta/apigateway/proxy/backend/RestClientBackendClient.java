package com.github.dimitryivaniuta.apigateway.proxy.backend;

import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Blocking {@link RestClient} exchange, moved off the request thread onto the backend executor and
 * bounded by a {@link TimeLimiter}. When the limiter fires, the caller sees the timeout immediately;
 * the underlying exchange ends on its own read timeout.
 */
@Slf4j
@Component
public class RestClientBackendClient implements BackendClient {

    private final RestClient restClient;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final TimeLimiter timeLimiter;

    public RestClientBackendClient(@Qualifier("backendRestClient") RestClient restClient,
                                   @Qualifier("backendExecutor") Executor executor,
                                   @Qualifier("backendTimeoutScheduler") ScheduledExecutorService scheduler,
                                   TimeLimiter timeLimiter) {
        this.restClient = restClient;
        this.executor = executor;
        this.scheduler = scheduler;
        this.timeLimiter = timeLimiter;
    }

    @Override
    public CompletableFuture<GatewayResponse> forward(BackendRequest request) {
        return timeLimiter.executeCompletionStage(scheduler,
                        () -> CompletableFuture.supplyAsync(() -> exchange(request), executor))
                .toCompletableFuture();
    }

    GatewayResponse exchange(BackendRequest request) {
        log.debug("Forwarding: service={}, method={}, url={}", request.service(), request.method(), request.targetUrl());

        RestClient.RequestBodySpec spec = restClient.method(HttpMethod.valueOf(request.method()))
                .uri(URI.create(request.targetUrl()))
                .headers(h -> h.addAll(request.headers()));
        if (request.body().length > 0) {
            spec = spec.body(request.body());
        }
        return spec.exchange((req, res) -> {
            HttpHeaders headers = new HttpHeaders();
            headers.putAll(res.getHeaders());
            byte[] body = StreamUtils.copyToByteArray(res.getBody());
            return new GatewayResponse(res.getStatusCode().value(), headers, body);
        });
    }
}
