package com.github.dimitryivaniuta.apigateway.proxy.routing;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.error.RouteNotFoundException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Maps a request to a configured backend service.
 *
 * <p>Longest matching path prefix wins. A prefix matches the path itself and anything below it
 * ({@code /api/user} matches {@code /api/user} and {@code /api/user/7}, not {@code /api/users}).
 * Without a match the service named by the routing header is used, if configured.
 */
@Component
public class ServiceRouter {

    private final List<PrefixRoute> prefixRoutes;
    private final Map<String, GatewayProperties.Service> services;
    private final String serviceHeader;

    public ServiceRouter(GatewayProperties props) {
        this.services = props.getServices();
        this.serviceHeader = props.getRouting().getServiceHeader();

        List<PrefixRoute> routes = new ArrayList<>();
        services.forEach((name, svc) -> svc.getPathPrefixes().forEach(p -> routes.add(new PrefixRoute(trimSlash(p), name))));
        routes.sort(Comparator.comparingInt((PrefixRoute r) -> r.prefix().length()).reversed());
        this.prefixRoutes = List.copyOf(routes);
    }

    public RouteTarget route(String path, HttpHeaders headers) {
        for (PrefixRoute r : prefixRoutes) {
            if (matches(path, r.prefix())) {
                return target(r.service());
            }
        }
        String named = serviceHeader == null ? null : headers.getFirst(serviceHeader);
        if (named != null && services.containsKey(named.trim())) {
            return target(named.trim());
        }
        throw new RouteNotFoundException("No backend service for path " + path);
    }

    private RouteTarget target(String service) {
        return new RouteTarget(service, services.get(service).getUrls());
    }

    private static boolean matches(String path, String prefix) {
        if (prefix.isEmpty()) return true;
        if (!path.startsWith(prefix)) return false;
        return path.length() == prefix.length() || path.charAt(prefix.length()) == '/';
    }

    private static String trimSlash(String p) {
        return p.endsWith("/") ? p.substring(0, p.length() - 1) : p;
    }

    private record PrefixRoute(String prefix, String service) {}
}
