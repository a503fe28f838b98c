package com.github.dimitryivaniuta.apigateway.proxy.ratelimit;

import java.util.Objects;

/**
 * Rate-limit key of one caller, immutable per request.
 *
 * <p>{@link #key()} format is stable and used for counter keys, cache scoping and logs:
 * <ul>
 *   <li>{@code user:<subject>}</li>
 *   <li>{@code ip:<normalized address>}</li>
 * </ul>
 */
public record ClientIdentity(Kind kind, String value) {

    public enum Kind {
        USER("user"),
        IP("ip");

        private final String tag;
        Kind(String tag) { this.tag = tag; }
        public String tag() { return tag; }
    }

    public ClientIdentity {
        Objects.requireNonNull(kind, "kind");
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("identity value must not be blank");
        }
    }

    public static ClientIdentity user(String subject) {
        return new ClientIdentity(Kind.USER, subject);
    }

    public static ClientIdentity ip(String address) {
        return new ClientIdentity(Kind.IP, address);
    }

    public String key() {
        return kind.tag() + ":" + value;
    }
}
