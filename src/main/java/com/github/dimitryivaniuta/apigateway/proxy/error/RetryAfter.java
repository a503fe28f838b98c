package com.github.dimitryivaniuta.apigateway.proxy.error;

import java.time.Duration;

/** Retry-After header value helper. */
public final class RetryAfter {
    private RetryAfter() {}

    /** Whole seconds, rounded up, never below 1. */
    public static long seconds(Duration d) {
        if (d == null || d.isNegative() || d.isZero()) return 1L;
        long s = d.getSeconds() + (d.getNano() > 0 ? 1 : 0);
        return Math.max(1L, s);
    }
}
