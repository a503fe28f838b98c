package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.error.ForbiddenException;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Source IP and Origin allow-lists.
 *
 * <p>{@code 0.0.0.0} or {@code *} in the IP list admits every address, {@code *} in the origin list
 * every origin. Requests without an {@code Origin} header (non-browser clients) pass the origin check.
 */
@Slf4j
@Component
public class SourceAccessValidator {

    private static final Set<String> ANY_IP = Set.of("0.0.0.0", "*");

    private final Set<String> allowedIps;
    private final boolean anyIp;
    private final Set<String> allowedOrigins;
    private final boolean anyOrigin;

    public SourceAccessValidator(GatewayProperties props) {
        this.allowedIps = props.getSecurity().getAllowedIps().stream()
                .map(ClientAddressResolver::normalize)
                .collect(Collectors.toUnmodifiableSet());
        this.anyIp = props.getSecurity().getAllowedIps().stream().map(String::trim).anyMatch(ANY_IP::contains);
        this.allowedOrigins = props.getSecurity().getAllowedOrigins().stream()
                .map(SourceAccessValidator::trimOrigin)
                .collect(Collectors.toUnmodifiableSet());
        this.anyOrigin = allowedOrigins.contains("*");
    }

    public void validate(GatewayRequest request, String clientIp) {
        if (!anyIp && !allowedIps.contains(clientIp)) {
            log.debug("Source address rejected: ip={}", clientIp);
            throw new ForbiddenException("Access denied from " + clientIp);
        }
        String origin = request.headers().getFirst(HttpHeaders.ORIGIN);
        if (origin != null && !anyOrigin && !allowedOrigins.contains(trimOrigin(origin))) {
            log.debug("Origin rejected: origin={}", origin);
            throw new ForbiddenException("Origin not allowed: " + origin);
        }
    }

    private static String trimOrigin(String o) {
        String t = o.trim();
        return t.endsWith("/") ? t.substring(0, t.length() - 1) : t;
    }
}
