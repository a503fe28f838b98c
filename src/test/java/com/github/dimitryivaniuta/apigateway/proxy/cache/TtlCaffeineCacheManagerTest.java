package com.github.dimitryivaniuta.apigateway.proxy.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TtlCaffeineCacheManagerTest {

    @Test
    void shouldCreateIndependentCachesForDifferentTtlNames() {
        CacheManager cm = new TtlCaffeineCacheManager(() -> Caffeine.newBuilder().maximumSize(10_000));

        Cache c300 = cm.getCache("gatewayResponses:ttl=300");
        Cache c30 = cm.getCache("gatewayResponses:ttl=30");

        assertThat(c300).isNotNull();
        assertThat(c30).isNotNull();
        assertThat(c300.getName()).isEqualTo("gatewayResponses:ttl=300");

        c300.put("k", "v1");
        assertThat(c300.get("k", String.class)).isEqualTo("v1");
        assertThat(c30.get("k")).isNull();
    }

    @Test
    void shouldReturnSameCacheInstanceForSameName() {
        CacheManager cm = new TtlCaffeineCacheManager(() -> Caffeine.newBuilder().maximumSize(10_000));

        assertThat(cm.getCache("x:ttl=10")).isSameAs(cm.getCache("x:ttl=10"));
    }

    @Test
    void nameFor_shouldRoundUpAndClamp() {
        assertThat(TtlCaffeineCacheManager.nameFor("r", Duration.ofSeconds(300))).isEqualTo("r:ttl=300");
        assertThat(TtlCaffeineCacheManager.nameFor("r", Duration.ofMillis(1500))).isEqualTo("r:ttl=2");
        assertThat(TtlCaffeineCacheManager.nameFor("r", Duration.ofMillis(10))).isEqualTo("r:ttl=1");
        assertThat(TtlCaffeineCacheManager.nameFor("r", Duration.ofDays(3))).isEqualTo("r:ttl=86400");
    }

    @Test
    void ttlSecondsOf_shouldParseSuffixOnly() {
        assertThat(TtlCaffeineCacheManager.ttlSecondsOf("r:ttl=45")).isEqualTo(45L);
        assertThat(TtlCaffeineCacheManager.ttlSecondsOf("r")).isNull();
        assertThat(TtlCaffeineCacheManager.ttlSecondsOf("r:ttl=0")).isEqualTo(1L);
        assertThat(TtlCaffeineCacheManager.ttlSecondsOf("r:ttl=99999999999999999999")).isEqualTo(86_400L);
    }
}
