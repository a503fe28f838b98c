package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.auth.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.apigateway.proxy.auth.BearerTokens;
import com.github.dimitryivaniuta.apigateway.proxy.auth.IdentityProvider;
import com.github.dimitryivaniuta.apigateway.proxy.auth.TokenRevocationService;
import com.github.dimitryivaniuta.apigateway.proxy.error.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Lets a caller revoke its own, still valid, bearer token. */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class TokenRevocationController {

    private final IdentityProvider identityProvider;
    private final TokenRevocationService revocationService;

    @PostMapping("/revoke")
    public Map<String, String> revoke(@RequestHeader HttpHeaders headers) {
        String token = BearerTokens.extract(headers)
                .orElseThrow(() -> new UnauthorizedException("Missing bearer token"));
        AuthenticatedPrincipal principal = identityProvider.validateToken(token);
        revocationService.revoke(token, principal.expiresAt());
        return Map.of("message", "Token revoked successfully");
    }
}
