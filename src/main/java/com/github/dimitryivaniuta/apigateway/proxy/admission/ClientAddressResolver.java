package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Source address of a request, in a canonical text form so that allow-list checks and rate-limit
 * keys agree: IPv4 dotted quad, IPv4-mapped IPv6 reduced to IPv4, other IPv6 compressed and lower-case.
 *
 * <p>Forwarding headers are honoured only when the gateway sits behind a trusted proxy.
 */
@Component
public class ClientAddressResolver {

    private final boolean trustForwardedHeaders;

    public ClientAddressResolver(GatewayProperties props) {
        this.trustForwardedHeaders = props.getSecurity().isTrustForwardedHeaders();
    }

    public String resolve(GatewayRequest request) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For may contain "client, proxy1, proxy2"
            String xff = header(request, "X-Forwarded-For");
            if (xff != null) {
                int comma = xff.indexOf(',');
                String first = (comma >= 0 ? xff.substring(0, comma) : xff).trim();
                if (!first.isBlank()) return normalize(first);
            }
            String realIp = header(request, "X-Real-IP");
            if (realIp != null) return normalize(realIp);
        }
        return normalize(request.remoteAddress());
    }

    public static String normalize(String address) {
        if (address == null || address.isBlank()) return "unknown";
        String a = address.trim();
        if (a.startsWith("[") && a.endsWith("]")) {
            a = a.substring(1, a.length() - 1);
        }
        int zone = a.indexOf('%');
        if (zone >= 0) a = a.substring(0, zone);
        if (a.indexOf(':') < 0) {
            return a.toLowerCase(Locale.ROOT);
        }
        try {
            // a literal with ':' is parsed without a DNS lookup
            InetAddress parsed = InetAddress.getByName(a);
            if (parsed instanceof Inet4Address) {
                return parsed.getHostAddress();
            }
            return compress(parsed.getAddress());
        } catch (UnknownHostException e) {
            return a.toLowerCase(Locale.ROOT);
        }
    }

    private static String compress(byte[] v6) {
        int[] groups = new int[8];
        for (int i = 0; i < 8; i++) {
            groups[i] = ((v6[2 * i] & 0xff) << 8) | (v6[2 * i + 1] & 0xff);
        }
        // longest run of zero groups (length >= 2) becomes "::"
        int bestStart = -1, bestLen = 0;
        for (int i = 0; i < 8; ) {
            if (groups[i] != 0) { i++; continue; }
            int j = i;
            while (j < 8 && groups[j] == 0) j++;
            if (j - i > bestLen) { bestStart = i; bestLen = j - i; }
            i = j;
        }
        if (bestLen < 2) bestStart = -1;

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 8; i++) {
            if (i == bestStart) {
                sb.append("::");
                i += bestLen - 1;
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':') sb.append(':');
            sb.append(Integer.toHexString(groups[i]));
        }
        return sb.toString();
    }

    private static String header(GatewayRequest req, String name) {
        String v = req.headers().getFirst(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
