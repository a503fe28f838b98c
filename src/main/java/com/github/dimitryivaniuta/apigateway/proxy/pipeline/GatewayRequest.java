package com.github.dimitryivaniuta.apigateway.proxy.pipeline;

import org.springframework.http.HttpHeaders;

import java.util.Locale;

/**
 * Inbound request as seen by the pipeline, detached from the servlet API.
 *
 * @param method        upper-case HTTP method
 * @param path          request path without query
 * @param rawQuery      query string as received, or null
 * @param headers       request headers (read-only)
 * @param body          request body, empty if none
 * @param remoteAddress peer address of the connection
 * @param correlationId id of this request in logs and in the forwarded {@code X-Request-Id}
 */
public record GatewayRequest(String method,
                             String path,
                             String rawQuery,
                             HttpHeaders headers,
                             byte[] body,
                             String remoteAddress,
                             String correlationId) {

    private static final byte[] EMPTY = new byte[0];

    public GatewayRequest {
        method = method.toUpperCase(Locale.ROOT);
        headers = HttpHeaders.readOnlyHttpHeaders(headers == null ? new HttpHeaders() : headers);
        body = body == null ? EMPTY : body;
    }

    public boolean isGet() {
        return "GET".equals(method);
    }

    /** Path plus {@code ?query} when a query is present. */
    public String pathAndQuery() {
        return (rawQuery == null || rawQuery.isEmpty()) ? path : path + "?" + rawQuery;
    }
}
