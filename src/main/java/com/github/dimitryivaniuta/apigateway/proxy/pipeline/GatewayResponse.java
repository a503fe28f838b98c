package com.github.dimitryivaniuta.apigateway.proxy.pipeline;

import org.springframework.http.HttpHeaders;

/** Response relayed to the caller; stored as-is in the response cache. */
public record GatewayResponse(int status, HttpHeaders headers, byte[] body) {

    private static final byte[] EMPTY = new byte[0];

    public GatewayResponse {
        HttpHeaders copy = new HttpHeaders();
        if (headers != null) copy.putAll(headers);
        headers = HttpHeaders.readOnlyHttpHeaders(copy);
        body = body == null ? EMPTY : body;
    }

    public boolean is2xx() {
        return status >= 200 && status < 300;
    }

    public GatewayResponse withHeader(String name, String value) {
        HttpHeaders h = new HttpHeaders();
        h.putAll(headers);
        h.set(name, value);
        return new GatewayResponse(status, h, body);
    }
}
