package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.dimitryivaniuta.apigateway.proxy.error.UnauthorizedException;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import io.jsonwebtoken.security.Jwk;
import io.jsonwebtoken.security.JwkSet;
import io.jsonwebtoken.security.Jwks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Realm signing keys, fetched from the identity provider's JWKS document.
 *
 * <p>The key set sits in a single-entry Caffeine cache refreshed {@code ttl} after each fetch; while a
 * refresh runs, readers keep verifying against the previous set. An unknown key id (key rotation)
 * forces a refresh, at most once per {@link #FORCED_REFRESH_INTERVAL}, so tokens carrying made-up key
 * ids cannot drive a fetch per request. A failed first fetch, or a failed forced refresh, rejects the token.
 */
@Slf4j
public class JwksKeySource {

    static final Duration FORCED_REFRESH_INTERVAL = Duration.ofSeconds(30);

    private static final String REALM_KEYS = "realm-keys";

    private final RestClient restClient;
    private final String certsUrl;
    private final Clock clock;
    private final LoadingCache<String, Map<String, Key>> keySets;
    private final AtomicReference<Instant> lastForcedRefresh = new AtomicReference<>();

    public JwksKeySource(RestClient restClient, String certsUrl, Duration ttl, Clock clock) {
        this.restClient = restClient;
        this.certsUrl = certsUrl;
        this.clock = clock;
        this.keySets = Caffeine.newBuilder()
                .refreshAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                // refresh on the caller's thread; the HTTP client timeout bounds it
                .executor(Runnable::run)
                .build(name -> fetch());
    }

    public static String certsUrl(String baseUrl, String realm) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/realms/" + realm + "/protocol/openid-connect/certs";
    }

    public Key keyFor(String kid) {
        Key key = lookup(keySets.get(REALM_KEYS), kid);
        if (key == null && claimForcedRefresh()) {
            log.debug("Unknown signing key, refreshing: kid={}", kid);
            key = lookup(forceRefresh(), kid);
        }
        if (key == null) {
            throw new UnauthorizedException("Unknown signing key");
        }
        return key;
    }

    private boolean claimForcedRefresh() {
        Instant now = clock.instant();
        Instant last = lastForcedRefresh.get();
        if (last != null && now.isBefore(last.plus(FORCED_REFRESH_INTERVAL))) {
            return false;
        }
        return lastForcedRefresh.compareAndSet(last, now);
    }

    private Map<String, Key> forceRefresh() {
        try {
            return keySets.refresh(REALM_KEYS).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UnauthorizedException u) {
                throw u;
            }
            throw new UnauthorizedException("Identity provider unavailable", e.getCause());
        }
    }

    private static Key lookup(Map<String, Key> keys, String kid) {
        if (kid == null) {
            // single-key realms often omit kid
            return keys.size() == 1 ? keys.values().iterator().next() : null;
        }
        return keys.get(kid);
    }

    private Map<String, Key> fetch() {
        String body;
        try {
            body = restClient.get().uri(certsUrl).retrieve().body(String.class);
        } catch (RuntimeException e) {
            log.warn("JWKS fetch failed: url={}, error={}", certsUrl, e.toString());
            throw new UnauthorizedException("Identity provider unavailable", e);
        }
        if (body == null) {
            throw new UnauthorizedException("Identity provider returned no keys");
        }

        Map<String, Key> fresh = new HashMap<>();
        try {
            JwkSet set = Jwks.setParser().build().parse(body);
            for (Jwk<?> jwk : set.getKeys()) {
                if (jwk.getId() != null) {
                    fresh.put(jwk.getId(), jwk.toKey());
                }
            }
        } catch (RuntimeException e) {
            log.warn("JWKS document unreadable: url={}, error={}", certsUrl, e.toString());
            throw new UnauthorizedException("Identity provider returned unreadable keys", e);
        }
        log.info("JWKS fetched: url={}, keys={}", certsUrl, fresh.size());
        return Map.copyOf(fresh);
    }
}
