package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.RateLimitTier;

import java.time.Instant;
import java.util.Set;

/**
 * Caller as established by the identity collaborator.
 * An anonymous principal (public paths only) has no subject and the standard tier.
 */
public record AuthenticatedPrincipal(String subject, RateLimitTier tier, Set<String> roles, Instant expiresAt) {

    private static final AuthenticatedPrincipal ANONYMOUS =
            new AuthenticatedPrincipal(null, RateLimitTier.STANDARD, Set.of(), null);

    public AuthenticatedPrincipal {
        roles = (roles == null) ? Set.of() : Set.copyOf(roles);
        tier = (tier == null) ? RateLimitTier.STANDARD : tier;
    }

    public static AuthenticatedPrincipal anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return subject == null;
    }

    public boolean hasAnyRole(Iterable<String> wanted) {
        for (String r : wanted) {
            if (roles.contains(r)) return true;
        }
        return false;
    }
}
