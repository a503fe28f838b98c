package com.github.dimitryivaniuta.apigateway.proxy.cache;

import com.github.dimitryivaniuta.apigateway.proxy.support.Hashes;
import org.springframework.http.HttpHeaders;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache key of a request: {@code cache:<sha256 hex>}.
 *
 * <p>Covers the method, the path, the query with parameters sorted by name (values keep their order),
 * the configured vary headers and, for {@link CacheScope#SUBJECT}, the client key.
 */
public final class RequestFingerprint {
    private RequestFingerprint() {}

    public static String of(String method,
                            String path,
                            String rawQuery,
                            HttpHeaders headers,
                            List<String> varyHeaders,
                            String subjectKey) {
        StringBuilder sb = new StringBuilder(128)
                .append(method.toUpperCase(Locale.ROOT)).append('\n')
                .append(path).append('\n')
                .append(normalizeQuery(rawQuery)).append('\n');

        for (String name : varyHeaders) {
            List<String> values = headers.getOrEmpty(name);
            sb.append(name.toLowerCase(Locale.ROOT)).append('=').append(String.join(",", values)).append('\n');
        }
        if (subjectKey != null) {
            sb.append("subject=").append(subjectKey);
        }
        return "cache:" + Hashes.sha256Hex(sb.toString());
    }

    static String normalizeQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        MultiValueMap<String, String> params = UriComponentsBuilder.newInstance().query(rawQuery).build().getQueryParams();
        Map<String, List<String>> sorted = new TreeMap<>(params);
        List<String> parts = new ArrayList<>();
        sorted.forEach((k, vs) -> {
            for (String v : vs) {
                parts.add(v == null ? k : k + "=" + v);
            }
        });
        return String.join("&", parts);
    }
}
