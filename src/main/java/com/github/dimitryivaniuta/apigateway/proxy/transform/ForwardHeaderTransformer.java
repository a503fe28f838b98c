package com.github.dimitryivaniuta.apigateway.proxy.transform;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Header rewriting in both directions.
 *
 * <p>Outbound: client-supplied forwarding headers are dropped (they could spoof the source address),
 * hop-by-hop headers are dropped, the gateway version and request id are added. Inbound: hop-by-hop
 * and framing headers are dropped, the servlet container frames the relayed body itself.
 */
@Component
public class ForwardHeaderTransformer {

    public static final String GATEWAY_VERSION_HEADER = "X-Gateway-Version";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final Set<String> HOP_BY_HOP = Set.of(
            "connection", "keep-alive", "proxy-connection", "proxy-authenticate", "proxy-authorization",
            "te", "trailer", "transfer-encoding", "upgrade"
    );

    // also rejected by the JDK HttpClient as restricted
    private static final Set<String> OUTBOUND_DROPPED = Set.of(
            "host", "content-length", "expect", "x-forwarded-for", "x-real-ip"
    );

    private static final Set<String> INBOUND_DROPPED = Set.of("content-length");

    private final String gatewayVersion;

    public ForwardHeaderTransformer(GatewayProperties props) {
        this.gatewayVersion = props.getBackend().getGatewayVersion();
    }

    public HttpHeaders outbound(HttpHeaders inbound, String requestId) {
        HttpHeaders out = new HttpHeaders();
        inbound.forEach((name, values) -> {
            String n = name.toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP.contains(n) && !OUTBOUND_DROPPED.contains(n)) {
                out.addAll(name, values);
            }
        });
        out.set(GATEWAY_VERSION_HEADER, gatewayVersion);
        if (requestId != null) {
            out.set(REQUEST_ID_HEADER, requestId);
        }
        return out;
    }

    public HttpHeaders inbound(HttpHeaders fromBackend) {
        HttpHeaders out = new HttpHeaders();
        fromBackend.forEach((name, values) -> {
            String n = name.toLowerCase(Locale.ROOT);
            if (!HOP_BY_HOP.contains(n) && !INBOUND_DROPPED.contains(n)) {
                out.addAll(name, values);
            }
        });
        return out;
    }
}
