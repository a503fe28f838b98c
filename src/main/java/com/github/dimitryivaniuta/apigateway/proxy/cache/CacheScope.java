package com.github.dimitryivaniuta.apigateway.proxy.cache;

/** Partitioning of cached responses between callers. */
public enum CacheScope {
    /**
     * Shared across all callers. Only safe when the cached routes return the same body to everybody.
     */
    GLOBAL,
    /**
     * Partitioned per client identity (user or source ip).
     */
    SUBJECT
}
