package com.github.dimitryivaniuta.apigateway.proxy.ratelimit;

public enum RateLimitTier {
    STANDARD("standard"),
    PREMIUM("premium");

    private final String tag;

    RateLimitTier(String tag) { this.tag = tag; }

    public String tag() { return tag; }
}
