package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.dimitryivaniuta.apigateway.proxy.error.UnauthorizedException;

/**
 * External identity collaborator: turns a bearer token into a principal.
 *
 * <p>Implementations must fail closed: if the provider cannot be reached, the token is rejected.
 */
public interface IdentityProvider {

    /**
     * @param token raw bearer token, without the {@code Bearer } prefix
     * @return the validated principal
     * @throws UnauthorizedException if the token is absent, malformed, expired, revoked or unverifiable
     */
    AuthenticatedPrincipal validateToken(String token);
}
