package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.error.UnauthorizedException;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Establishes the caller of a request. A bearer token, when present, is always validated, even on
 * public paths; only public paths accept a request without one.
 */
@Component
public class RequestAuthenticator {

    private final IdentityProvider identityProvider;
    private final List<String> publicPaths;

    public RequestAuthenticator(IdentityProvider identityProvider, GatewayProperties props) {
        this.identityProvider = identityProvider;
        this.publicPaths = List.copyOf(props.getIdentity().getPublicPaths());
    }

    public AuthenticatedPrincipal authenticate(GatewayRequest request) {
        Optional<String> token = BearerTokens.extract(request.headers());
        if (token.isPresent()) {
            return identityProvider.validateToken(token.get());
        }
        if (isPublic(request.path())) {
            return AuthenticatedPrincipal.anonymous();
        }
        throw new UnauthorizedException("Missing bearer token");
    }

    public boolean isPublic(String path) {
        for (String p : publicPaths) {
            if (path.startsWith(p)) return true;
        }
        return false;
    }
}
