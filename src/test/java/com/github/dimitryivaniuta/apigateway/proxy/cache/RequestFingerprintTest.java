package com.github.dimitryivaniuta.apigateway.proxy.cache;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprintTest {

    private static final List<String> VARY = List.of("Accept");

    private static HttpHeaders accept(String value) {
        HttpHeaders h = new HttpHeaders();
        h.set(HttpHeaders.ACCEPT, value);
        return h;
    }

    @Test
    void shouldBeStableAndPrefixed() {
        String a = RequestFingerprint.of("GET", "/api/public/items", "a=1", accept("application/json"), VARY, "user:1");
        String b = RequestFingerprint.of("get", "/api/public/items", "a=1", accept("application/json"), VARY, "user:1");

        assertThat(a).isEqualTo(b).startsWith("cache:").hasSize("cache:".length() + 64);
    }

    @Test
    void queryParameterOrder_shouldNotMatter() {
        String a = RequestFingerprint.of("GET", "/p", "b=2&a=1", new HttpHeaders(), VARY, null);
        String b = RequestFingerprint.of("GET", "/p", "a=1&b=2", new HttpHeaders(), VARY, null);

        assertThat(a).isEqualTo(b);
        assertThat(RequestFingerprint.normalizeQuery("b=2&a=1&a=0")).isEqualTo("a=1&a=0&b=2");
    }

    @Test
    void differentPathQueryHeaderOrSubject_shouldDiffer() {
        String base = RequestFingerprint.of("GET", "/p", "a=1", accept("application/json"), VARY, "user:1");

        assertThat(RequestFingerprint.of("GET", "/q", "a=1", accept("application/json"), VARY, "user:1")).isNotEqualTo(base);
        assertThat(RequestFingerprint.of("GET", "/p", "a=2", accept("application/json"), VARY, "user:1")).isNotEqualTo(base);
        assertThat(RequestFingerprint.of("GET", "/p", "a=1", accept("text/plain"), VARY, "user:1")).isNotEqualTo(base);
        assertThat(RequestFingerprint.of("GET", "/p", "a=1", accept("application/json"), VARY, "user:2")).isNotEqualTo(base);
        assertThat(RequestFingerprint.of("GET", "/p", "a=1", accept("application/json"), VARY, null)).isNotEqualTo(base);
    }

    @Test
    void headersOutsideVaryList_shouldBeIgnored() {
        HttpHeaders h = accept("application/json");
        h.set("X-Trace", "abc");

        assertThat(RequestFingerprint.of("GET", "/p", null, h, VARY, null))
                .isEqualTo(RequestFingerprint.of("GET", "/p", "", accept("application/json"), VARY, null));
    }
}
