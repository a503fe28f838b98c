package com.github.dimitryivaniuta.apigateway.proxy.cache;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fingerprint -> response store on top of the Spring cache abstraction.
 *
 * <p>Entries live in the cache named for their ttl ({@link TtlCaffeineCacheManager#nameFor}), so an
 * entry put with a ttl longer than the default is not reclaimed early. A fingerprint is held by at
 * most one of those caches at a time.
 *
 * <p>Freshness is checked on every read against the caller's {@code now}; the backing cache's own
 * expiry only reclaims memory. Any failure of the store is logged and treated as a miss (or a
 * skipped write), never propagated to the request.
 */
@Slf4j
@Component
public class ResponseCache {

    static final String CACHE_BASE_NAME = "gatewayResponses";

    private final CacheManager cacheManager;
    private final Duration defaultTtl;
    private final boolean enabled;
    private final String defaultCacheName;
    private final Set<String> cacheNames = ConcurrentHashMap.newKeySet();

    public ResponseCache(CacheManager cacheManager, GatewayProperties props) {
        this.cacheManager = cacheManager;
        this.defaultTtl = props.getCache().getTtl();
        this.enabled = props.getCache().isEnabled();
        this.defaultCacheName = TtlCaffeineCacheManager.nameFor(CACHE_BASE_NAME, defaultTtl);
        this.cacheNames.add(defaultCacheName);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<GatewayResponse> get(String fingerprint, Instant now) {
        if (!enabled) return Optional.empty();
        try {
            for (String name : cacheNames) {
                Cache cache = cacheManager.getCache(name);
                CacheEntry entry = cache == null ? null : cache.get(fingerprint, CacheEntry.class);
                if (entry == null) continue;
                if (entry.isExpired(now)) {
                    cache.evictIfPresent(fingerprint);
                    return Optional.empty();
                }
                return Optional.of(entry.response());
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Response cache read failed, treating as miss: key={}, error={}", fingerprint, e.toString());
            return Optional.empty();
        }
    }

    public void put(String fingerprint, GatewayResponse response, Instant now) {
        put(fingerprint, response, now, defaultTtl);
    }

    public void put(String fingerprint, GatewayResponse response, Instant now, Duration ttl) {
        if (!enabled) return;
        try {
            String target = TtlCaffeineCacheManager.nameFor(CACHE_BASE_NAME, ttl);
            cacheNames.add(target);
            for (String name : cacheNames) {
                Cache cache = cacheManager.getCache(name);
                if (cache == null) continue;
                if (name.equals(target)) {
                    cache.put(fingerprint, new CacheEntry(response, now, ttl));
                } else {
                    cache.evictIfPresent(fingerprint);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Response cache write failed: key={}, error={}", fingerprint, e.toString());
        }
    }

    public void clear() {
        for (String name : cacheNames) {
            Cache cache = cacheManager.getCache(name);
            if (cache != null) cache.clear();
        }
    }
}
