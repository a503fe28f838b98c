package com.github.dimitryivaniuta.apigateway.proxy.cache;

import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached response and its freshness bounds. Served up to and including {@code recordedAt + ttl}.
 */
public record CacheEntry(GatewayResponse response, Instant recordedAt, Duration ttl) {

    public Instant expiresAt() {
        return recordedAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }
}
