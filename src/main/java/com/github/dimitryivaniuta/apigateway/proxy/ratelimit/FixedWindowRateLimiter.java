package com.github.dimitryivaniuta.apigateway.proxy.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.time.TimeWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-window request counting per client identity.
 *
 * <p>Each (identity, window start) pair owns one counter. The increment and the read of the
 * resulting count are a single atomic {@code merge} on that key, so of {@code T} concurrently
 * arriving requests against a budget of {@code T} exactly {@code T} are admitted. Unrelated
 * identities never contend on the same key.
 *
 * <p>Counters of past windows are never consulted again (the window start is part of the key) and are
 * dropped by Caffeine two windows after their last write. A client may get up to {@code 2 * T}
 * requests through around a window boundary; that is inherent to fixed windows.
 *
 * <p>Rejected requests also increment the counter; this does not change what is admitted.
 */
@Slf4j
@Component
public class FixedWindowRateLimiter {

    private final boolean enabled;
    private final TimeWindow window;
    private final long standardLimit;
    private final long premiumLimit;

    private final Cache<WindowKey, Long> counters;

    public FixedWindowRateLimiter(GatewayProperties props) {
        GatewayProperties.RateLimit cfg = props.getRateLimit();
        this.enabled = cfg.isEnabled();
        this.window = TimeWindow.of(cfg.getWindow());
        this.standardLimit = cfg.getRequests();
        this.premiumLimit = (long) cfg.getRequests() * cfg.getPremiumMultiplier();
        this.counters = Caffeine.newBuilder()
                .expireAfterWrite(cfg.getWindow().multipliedBy(2))
                .build();
    }

    public RateLimitDecision admit(ClientIdentity identity, RateLimitTier tier, Instant now) {
        Objects.requireNonNull(identity, "identity");
        long limit = limitFor(tier);
        Instant windowStart = window.startOf(now);
        Instant windowEnd = windowStart.plus(window.length());

        if (!enabled) {
            return new RateLimitDecision(true, 0, limit, windowEnd, window.remaining(now));
        }

        Long count = counters.asMap().merge(new WindowKey(identity.key(), windowStart.toEpochMilli()), 1L, Long::sum);
        boolean allowed = count <= limit;
        if (!allowed) {
            log.debug("Rate limit exceeded: client={}, tier={}, count={}, limit={}", identity.key(), tier.tag(), count, limit);
        }
        return new RateLimitDecision(allowed, count, limit, windowEnd, window.remaining(now));
    }

    public long limitFor(RateLimitTier tier) {
        return tier == RateLimitTier.PREMIUM ? premiumLimit : standardLimit;
    }

    /** Number of live counters; drops to zero after {@link #reset()}. */
    public long trackedCounters() {
        counters.cleanUp();
        return counters.estimatedSize();
    }

    public void reset() {
        counters.invalidateAll();
    }

    private record WindowKey(String clientKey, long windowStartMillis) {}
}
