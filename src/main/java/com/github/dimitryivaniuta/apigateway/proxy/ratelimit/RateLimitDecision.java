package com.github.dimitryivaniuta.apigateway.proxy.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one {@link FixedWindowRateLimiter#admit} call.
 *
 * @param allowed    whether the request is admitted
 * @param count      counter value after this request's increment
 * @param limit      threshold of the caller's tier
 * @param windowEnd  instant the current window closes
 * @param retryAfter {@code windowEnd - now}; meaningful only when rejected
 */
public record RateLimitDecision(boolean allowed, long count, long limit, Instant windowEnd, Duration retryAfter) {

    public long remaining() {
        return Math.max(0, limit - count);
    }
}
