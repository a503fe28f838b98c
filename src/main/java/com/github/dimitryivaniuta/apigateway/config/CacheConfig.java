package com.github.dimitryivaniuta.apigateway.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.cache.TtlCaffeineCacheManager;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Response cache store:
 * - Caffeine local cache, bounded by gateway.cache.maximum-size
 * - TTL per cache via name convention "cacheName:ttl=NN" (TtlCaffeineCacheManager)
 *
 * State is per gateway instance; nothing is shared between instances.
 */
@Configuration
public class CacheConfig {

    @Bean
    public CacheManager cacheManager(GatewayProperties props) {
        long maximumSize = props.getCache().getMaximumSize();
        return new TtlCaffeineCacheManager(() ->
                Caffeine.newBuilder()
                        .maximumSize(maximumSize)
                        .recordStats()
        );
    }
}
