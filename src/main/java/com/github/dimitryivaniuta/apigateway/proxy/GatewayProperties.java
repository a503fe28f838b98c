package com.github.dimitryivaniuta.apigateway.proxy;

import com.github.dimitryivaniuta.apigateway.proxy.cache.CacheScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externally supplied gateway configuration, bound from {@code gateway.*}.
 *
 * <p>Defaults reproduce a single-host development deployment: two backend services on localhost,
 * 100 requests per minute for standard clients, 5-failure breakers with a 60s cool-down.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @Valid
    private Identity identity = new Identity();

    @Valid
    private Security security = new Security();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    @Valid
    private Backend backend = new Backend();

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Access access = new Access();

    // service name -> instances and routes; insertion order kept for deterministic registry start-up
    private Map<String, Service> services = new LinkedHashMap<>();

    public enum IdentityMode {
        /** Shared-secret (HS256) tokens. */
        HMAC,
        /** RS256 tokens signed by the realm keys published by the identity provider. */
        JWKS
    }

    @Getter
    @Setter
    public static class Identity {
        @NotNull
        private IdentityMode mode = IdentityMode.HMAC;
        private String url = "http://localhost:8080";
        private String realm = "master";
        private String jwtSecret = "change-me-change-me-change-me-change-me";
        @NotNull
        private Duration jwksTtl = Duration.ofHours(1);
        @NotNull
        @DurationMin(millis = 1)
        private Duration timeout = Duration.ofSeconds(5);
        private String tierClaim = "tier";
        private String premiumRole = "premium";
        private List<String> publicPaths = new ArrayList<>(List.of("/api/public/"));
    }

    @Getter
    @Setter
    public static class Security {
        private List<String> allowedIps = new ArrayList<>(List.of("127.0.0.1", "::1"));
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
        private boolean trustForwardedHeaders = false;
        @Min(1)
        private long maxPayloadBytes = 10L * 1024 * 1024;
        private List<String> sensitiveFields = new ArrayList<>(List.of(
                "password", "token_secret", "internal_flag", "secret_key",
                "private_key", "api_key", "auth_token", "session_id"
        ));
        private Map<String, String> responseHeaders = new LinkedHashMap<>(Map.of(
                "X-Frame-Options", "DENY",
                "X-Content-Type-Options", "nosniff",
                "X-XSS-Protection", "1; mode=block",
                "Strict-Transport-Security", "max-age=31536000; includeSubDomains",
                "Referrer-Policy", "strict-origin-when-cross-origin",
                "Content-Security-Policy", "default-src 'self'",
                "Permissions-Policy", "geolocation=(), microphone=(), camera=()"
        ));
    }

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        @Min(1)
        private int requests = 100;
        @NotNull
        @DurationMin(millis = 1)
        private Duration window = Duration.ofSeconds(60);
        @Min(1)
        private int premiumMultiplier = 10;
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        @NotNull
        @DurationMin(millis = 1)
        private Duration ttl = Duration.ofSeconds(300);
        @Min(1)
        private long maximumSize = 50_000;
        @NotNull
        private CacheScope scope = CacheScope.SUBJECT;
        private List<String> cacheablePaths = new ArrayList<>(List.of("/api/public/", "/api/config/", "/api/health"));
        private List<String> varyHeaders = new ArrayList<>(List.of("Accept"));
    }

    @Getter
    @Setter
    public static class CircuitBreaker {
        @Min(1)
        private int failureThreshold = 5;
        @NotNull
        @DurationMin(millis = 1)
        private Duration recoveryTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Backend {
        @NotNull
        @DurationMin(millis = 1)
        private Duration timeout = Duration.ofSeconds(30);
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @Min(1)
        private int poolSize = 64;
        private String gatewayVersion = "1.0";
    }

    @Getter
    @Setter
    public static class Routing {
        private String serviceHeader = "X-Service-Type";
    }

    @Getter
    @Setter
    public static class Access {
        private List<AccessRule> rules = new ArrayList<>(List.of(
                new AccessRule("/api/admin", List.of("admin")),
                new AccessRule("/api/user", List.of("user", "admin"))
        ));
        private List<String> ownerScopedPrefixes = new ArrayList<>(List.of("/api/user/"));
    }

    @Getter
    @Setter
    public static class AccessRule {
        private String pathPrefix;
        private List<String> roles = new ArrayList<>();

        public AccessRule() {
        }

        public AccessRule(String pathPrefix, List<String> roles) {
            this.pathPrefix = pathPrefix;
            this.roles = new ArrayList<>(roles);
        }
    }

    @Getter
    @Setter
    public static class Service {
        private List<String> urls = new ArrayList<>();
        private List<String> pathPrefixes = new ArrayList<>();
    }
}
