package com.github.dimitryivaniuta.apigateway.proxy.auth;

import org.springframework.http.HttpHeaders;

import java.util.Optional;

public final class BearerTokens {
    private BearerTokens() {}

    private static final String PREFIX = "bearer ";

    /** Token from {@code Authorization: Bearer <token>}; empty if absent or another scheme. */
    public static Optional<String> extract(HttpHeaders headers) {
        String v = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (v == null) return Optional.empty();
        v = v.trim();
        if (v.length() <= PREFIX.length() || !v.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        String token = v.substring(PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
