package com.github.dimitryivaniuta.apigateway.proxy.backend;

import org.springframework.http.HttpHeaders;

/**
 * One outbound call to a selected instance.
 *
 * @param service     logical service name, for metrics and logs
 * @param instanceUrl base URL of the chosen instance
 * @param method      HTTP method, preserved from the inbound request
 * @param pathAndQuery path and raw query, preserved from the inbound request
 * @param headers     already transformed outbound headers
 * @param body        request body, possibly empty
 */
public record BackendRequest(String service,
                             String instanceUrl,
                             String method,
                             String pathAndQuery,
                             HttpHeaders headers,
                             byte[] body) {

    public String targetUrl() {
        String base = instanceUrl.endsWith("/") ? instanceUrl.substring(0, instanceUrl.length() - 1) : instanceUrl;
        return base + pathAndQuery;
    }
}
