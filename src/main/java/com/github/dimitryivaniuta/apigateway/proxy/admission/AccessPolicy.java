package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.auth.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.apigateway.proxy.error.ForbiddenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Role and ownership rules, checked after rate limiting.
 *
 * <ul>
 *   <li>The longest rule whose prefix matches the path applies; the caller needs any of its roles.
 *       A prefix covers the path itself and what lies below it: {@code /api/user} governs
 *       {@code /api/user/7} but not {@code /api/users}.</li>
 *   <li>Below an owner-scoped prefix the first path segment is a user id, and only that user may call it.</li>
 * </ul>
 */
@Slf4j
@Component
public class AccessPolicy {

    private final List<GatewayProperties.AccessRule> rules;
    private final List<String> ownerScopedPrefixes;

    public AccessPolicy(GatewayProperties props) {
        this.rules = props.getAccess().getRules().stream()
                .sorted(Comparator.comparingInt((GatewayProperties.AccessRule r) -> r.getPathPrefix().length()).reversed())
                .toList();
        this.ownerScopedPrefixes = List.copyOf(props.getAccess().getOwnerScopedPrefixes());
    }

    public void check(AuthenticatedPrincipal principal, String path) {
        for (GatewayProperties.AccessRule rule : rules) {
            if (governs(rule.getPathPrefix(), path)) {
                if (!rule.getRoles().isEmpty() && !principal.hasAnyRole(rule.getRoles())) {
                    log.debug("Insufficient roles: subject={}, path={}, required={}", principal.subject(), path, rule.getRoles());
                    throw new ForbiddenException("Insufficient permissions");
                }
                break;
            }
        }

        for (String prefix : ownerScopedPrefixes) {
            if (path.startsWith(prefix) && path.length() > prefix.length()) {
                String rest = path.substring(prefix.length());
                int slash = rest.indexOf('/');
                String resourceId = slash >= 0 ? rest.substring(0, slash) : rest;
                if (!resourceId.isEmpty() && !resourceId.equals(principal.subject())) {
                    log.debug("Ownership check failed: subject={}, resource={}", principal.subject(), resourceId);
                    throw new ForbiddenException("Access denied: resource ownership check failed");
                }
            }
        }
    }

    private static boolean governs(String prefix, String path) {
        String p = prefix.endsWith("/") ? prefix.substring(0, prefix.length() - 1) : prefix;
        if (p.isEmpty()) return true;
        if (!path.startsWith(p)) return false;
        return path.length() == p.length() || path.charAt(p.length()) == '/';
    }
}
