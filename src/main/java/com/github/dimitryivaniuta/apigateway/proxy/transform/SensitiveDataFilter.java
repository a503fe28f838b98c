package com.github.dimitryivaniuta.apigateway.proxy.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes configured fields, at any depth, from JSON response bodies. Field names match
 * case-insensitively. Non-JSON or unparseable bodies are relayed unchanged.
 */
@Slf4j
@Component
public class SensitiveDataFilter {

    private final ObjectMapper objectMapper;
    private final Set<String> sensitiveFields;

    public SensitiveDataFilter(ObjectMapper objectMapper, GatewayProperties props) {
        this.objectMapper = objectMapper;
        this.sensitiveFields = props.getSecurity().getSensitiveFields().stream()
                .map(f -> f.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** @return the filtered body, or {@code body} itself when nothing was removed */
    public byte[] filter(HttpHeaders headers, byte[] body) {
        if (body.length == 0 || sensitiveFields.isEmpty() || !isJson(headers)) {
            return body;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Response declared JSON but did not parse, relaying as is: {}", e.getMessage());
            return body;
        }
        if (root == null || !strip(root)) {
            return body;
        }
        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Re-serializing filtered response failed", e);
        }
    }

    private boolean strip(JsonNode node) {
        boolean changed = false;
        if (node.isObject()) {
            ObjectNode obj = (ObjectNode) node;
            List<String> doomed = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = obj.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (sensitiveFields.contains(f.getKey().toLowerCase(Locale.ROOT))) {
                    doomed.add(f.getKey());
                } else {
                    changed |= strip(f.getValue());
                }
            }
            if (!doomed.isEmpty()) {
                obj.remove(doomed);
                changed = true;
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                changed |= strip(item);
            }
        }
        return changed;
    }

    private static boolean isJson(HttpHeaders headers) {
        MediaType ct;
        try {
            ct = headers.getContentType();
        } catch (InvalidMediaTypeException e) {
            // not filterable; relayed untouched
            return false;
        }
        return ct != null && (MediaType.APPLICATION_JSON.isCompatibleWith(ct) || ct.getSubtype().endsWith("+json"));
    }
}
