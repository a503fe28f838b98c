package com.github.dimitryivaniuta.apigateway.proxy.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager with the write TTL encoded in the cache name:
 *
 *   "gatewayResponses:ttl=300"  -> expireAfterWrite 300 seconds
 *   "gatewayResponses"          -> base builder only
 *
 * Names with different TTLs are different caches. TTL is clamped to [1s, 24h].
 * Caffeine builders are mutable, so a fresh one is taken from the supplier for every cache.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_PATTERN = Pattern.compile("^(?<base>.+?)(?::ttl=(?<ttl>\\d+))?$");
    static final long MIN_TTL_SECONDS = 1;
    static final long MAX_TTL_SECONDS = 24 * 60 * 60;

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
    }

    /** Cache name for {@code base} expiring entries {@code ttl} after write, rounded up to whole seconds. */
    public static String nameFor(String base, Duration ttl) {
        long seconds = ttl.getSeconds() + (ttl.getNano() > 0 ? 1 : 0);
        return base + ":ttl=" + clamp(seconds, MIN_TTL_SECONDS, MAX_TTL_SECONDS);
    }

    /** Parsed write TTL of a cache name, or null when the name carries none. */
    static Long ttlSecondsOf(String name) {
        if (name == null || name.isBlank()) return null;
        Matcher m = TTL_PATTERN.matcher(name.trim());
        if (!m.matches() || m.group("ttl") == null) return null;
        try {
            return clamp(Long.parseLong(m.group("ttl")), MIN_TTL_SECONDS, MAX_TTL_SECONDS);
        } catch (NumberFormatException ex) {
            // more digits than a long holds
            return MAX_TTL_SECONDS;
        }
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    private Cache createCache(String name) {
        Caffeine<Object, Object> builder = baseBuilderFactory.get();
        Long ttl = ttlSecondsOf(name);
        if (ttl != null) {
            builder = builder.expireAfterWrite(Duration.ofSeconds(ttl));
        }
        // null values are never stored
        return new CaffeineCache(name, builder.build(), false);
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        return Math.min(v, max);
    }
}
