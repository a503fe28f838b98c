package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.apigateway.proxy.support.Hashes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Local revocation list. Only a SHA-256 of the token is kept, until the token's own expiry and
 * never longer than {@link #MAX_RETENTION}.
 */
@Slf4j
@Service
public class TokenRevocationService {

    static final Duration MAX_RETENTION = Duration.ofHours(24);

    private final Clock clock;
    // token hash -> instant after which the entry is irrelevant
    private final Cache<String, Instant> revoked = Caffeine.newBuilder()
            .expireAfterWrite(MAX_RETENTION)
            .build();

    public TokenRevocationService(Clock clock) {
        this.clock = clock;
    }

    public void revoke(String token, Instant tokenExpiry) {
        Instant now = clock.instant();
        Instant cap = now.plus(MAX_RETENTION);
        Instant until = (tokenExpiry == null || tokenExpiry.isAfter(cap)) ? cap : tokenExpiry;
        revoked.put(Hashes.sha256Hex(token), until);
        log.info("Token revoked until {}", until);
    }

    public boolean isRevoked(String token) {
        String hash = Hashes.sha256Hex(token);
        Instant until = revoked.getIfPresent(hash);
        if (until == null) return false;
        if (!clock.instant().isBefore(until)) {
            revoked.invalidate(hash);
            return false;
        }
        return true;
    }
}
