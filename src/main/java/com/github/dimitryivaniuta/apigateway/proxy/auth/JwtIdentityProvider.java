package com.github.dimitryivaniuta.apigateway.proxy.auth;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.error.UnauthorizedException;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.RateLimitTier;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import javax.crypto.spec.SecretKeySpec;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Validates bearer JWTs locally, either against the shared HMAC secret or against the realm's
 * published keys.
 */
@Slf4j
@Component
public class JwtIdentityProvider implements IdentityProvider {

    private final GatewayProperties.Identity cfg;
    private final TokenRevocationService revocations;
    private final JwtParser parser;

    @Autowired
    public JwtIdentityProvider(GatewayProperties props,
                               TokenRevocationService revocations,
                               RestClient.Builder restClientBuilder,
                               Clock clock) {
        this.cfg = props.getIdentity();
        this.revocations = revocations;

        var builder = Jwts.parser().clock(() -> Date.from(clock.instant()));
        if (cfg.getMode() == GatewayProperties.IdentityMode.JWKS) {
            HttpClient http = HttpClient.newBuilder().connectTimeout(cfg.getTimeout()).build();
            JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(http);
            rf.setReadTimeout(cfg.getTimeout());
            JwksKeySource keys = new JwksKeySource(
                    restClientBuilder.clone().requestFactory(rf).build(),
                    JwksKeySource.certsUrl(cfg.getUrl(), cfg.getRealm()),
                    cfg.getJwksTtl(),
                    clock);
            builder.keyLocator(new LocatorAdapter<Key>() {
                @Override
                protected Key locate(JwsHeader header) {
                    return keys.keyFor(header.getKeyId());
                }
            });
        } else {
            builder.verifyWith(new SecretKeySpec(cfg.getJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        }
        this.parser = builder.build();
    }

    // visible for tests that supply their own key source
    JwtIdentityProvider(GatewayProperties props, TokenRevocationService revocations, JwksKeySource keys, Clock clock) {
        this.cfg = props.getIdentity();
        this.revocations = revocations;
        this.parser = Jwts.parser()
                .clock(() -> Date.from(clock.instant()))
                .keyLocator(new LocatorAdapter<Key>() {
                    @Override
                    protected Key locate(JwsHeader header) {
                        return keys.keyFor(header.getKeyId());
                    }
                })
                .build();
    }

    @Override
    public AuthenticatedPrincipal validateToken(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing token");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new UnauthorizedException("Token has expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new UnauthorizedException("Invalid token", e);
        }

        if (revocations.isRevoked(token)) {
            throw new UnauthorizedException("Token has been revoked");
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            Object userId = claims.get("user_id");
            subject = userId == null ? null : userId.toString();
        }
        if (subject == null || subject.isBlank()) {
            throw new UnauthorizedException("Token has no subject");
        }

        Set<String> roles = roles(claims);
        boolean premium = cfg.getPremiumRole() != null && roles.contains(cfg.getPremiumRole())
                || RateLimitTier.PREMIUM.tag().equalsIgnoreCase(String.valueOf(claims.get(cfg.getTierClaim())));
        Date exp = claims.getExpiration();
        Instant expiresAt = exp == null ? null : exp.toInstant();

        return new AuthenticatedPrincipal(subject, premium ? RateLimitTier.PREMIUM : RateLimitTier.STANDARD, roles, expiresAt);
    }

    private static Set<String> roles(Claims claims) {
        Set<String> out = new LinkedHashSet<>();
        Object realmAccess = claims.get("realm_access");
        if (realmAccess instanceof Map<?, ?> m && m.get("roles") instanceof Collection<?> c) {
            c.forEach(r -> out.add(String.valueOf(r)));
        }
        if (claims.get("roles") instanceof Collection<?> c) {
            c.forEach(r -> out.add(String.valueOf(r)));
        }
        return out;
    }
}
