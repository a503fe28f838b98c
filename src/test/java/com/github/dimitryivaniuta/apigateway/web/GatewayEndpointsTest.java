package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.auth.IdentityProvider;
import com.github.dimitryivaniuta.apigateway.proxy.auth.JwtIdentityProvider;
import com.github.dimitryivaniuta.apigateway.proxy.backend.BackendClient;
import com.github.dimitryivaniuta.apigateway.proxy.balancer.RoundRobinBackendSelector;
import com.github.dimitryivaniuta.apigateway.proxy.breaker.CircuitBreakerService;
import com.github.dimitryivaniuta.apigateway.proxy.cache.ResponseCache;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.apigateway.support.MutableClock;
import com.github.dimitryivaniuta.apigateway.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.web.filter.CorsFilter;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class GatewayEndpointsTest {

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock();
        }
    }

    @Autowired MockMvc mvc;
    @Autowired MutableClock clock;
    @Autowired FixedWindowRateLimiter rateLimiter;
    @Autowired CircuitBreakerService breakers;
    @Autowired ResponseCache responseCache;
    @Autowired RoundRobinBackendSelector selector;

    @Autowired IdentityProvider identityProvider;
    @Autowired FilterRegistrationBean<CorsFilter> corsFilter;

    @MockBean BackendClient backend;

    @BeforeEach
    void reset() {
        clock.set(MutableClock.START);
        rateLimiter.reset();
        breakers.reset();
        responseCache.clear();
        selector.reset();

        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        when(backend.forward(any())).thenAnswer(inv -> CompletableFuture.completedFuture(new GatewayResponse(
                200, h, "{\"id\":1,\"password\":\"hunter2\"}".getBytes(StandardCharsets.UTF_8))));
    }

    /** Gateway calls complete asynchronously; the result is only visible after the async dispatch. */
    private ResultActions call(RequestBuilder builder) throws Exception {
        MvcResult started = mvc.perform(builder).andExpect(request().asyncStarted()).andReturn();
        return mvc.perform(asyncDispatch(started));
    }

    private String bearer(String subject, String... roles) {
        return "Bearer " + TestTokens.token(clock, subject, List.of(roles));
    }

    @Test
    void context_shouldWireTokenValidatorAndCorsFilter() {
        assertThat(identityProvider).isInstanceOf(JwtIdentityProvider.class);
        assertThat(corsFilter.getFilter()).isInstanceOf(CorsFilter.class);
    }

    @Test
    void authenticatedRequest_shouldBeRelayedWithGatewayHeaders() throws Exception {
        call(get("/api/order/1")
                .header(HttpHeaders.AUTHORIZATION, bearer("1", "user"))
                .header("X-Correlation-Id", "it-corr-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-Id", "it-corr-1"))
                .andExpect(header().string("X-Frame-Options", "DENY"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.password").doesNotExist());
    }

    @Test
    void missingToken_shouldBe401WithErrorBody() throws Exception {
        call(get("/api/order/1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.message").value("Missing bearer token"));

        verify(backend, never()).forward(any());
    }

    @Test
    void exceedingTheLimit_shouldBe429WithRetryAfter() throws Exception {
        String token = bearer("5", "user");
        for (int i = 0; i < 3; i++) {
            call(get("/api/order/" + i).header(HttpHeaders.AUTHORIZATION, token)).andExpect(status().isOk());
        }

        call(get("/api/order/4").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"));
    }

    @Test
    void revokedToken_shouldNoLongerBeAccepted() throws Exception {
        String token = bearer("9", "user");

        mvc.perform(post("/auth/revoke").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Token revoked successfully"));

        call(get("/api/order/1").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Token has been revoked"));
    }

    @Test
    void publicPath_shouldBeCachedAcrossCalls() throws Exception {
        call(get("/api/public/info")).andExpect(status().isOk()).andExpect(header().string("X-Cache", "MISS"));
        call(get("/api/public/info")).andExpect(status().isOk()).andExpect(header().string("X-Cache", "HIT"));
    }

    @Test
    void backendFailures_shouldOpenTheBreakerAndShowOnActuator() throws Exception {
        when(backend.forward(any())).thenAnswer(inv ->
                CompletableFuture.completedFuture(new GatewayResponse(500, new HttpHeaders(), new byte[0])));
        for (int i = 0; i < 5; i++) {
            rateLimiter.reset();
            call(get("/api/order/1").header(HttpHeaders.AUTHORIZATION, bearer("1", "user")))
                    .andExpect(status().isBadGateway());
        }
        rateLimiter.reset();

        call(get("/api/order/1").header(HttpHeaders.AUTHORIZATION, bearer("1", "user")))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "60"));

        mvc.perform(get("/actuator/circuitbreakers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['order-service'].failedCalls").value(5));
    }

    @Test
    void revokeFromAddressOutsideAllowList_shouldBe403AndLeaveTokenValid() throws Exception {
        String token = bearer("9", "user");

        mvc.perform(post("/auth/revoke")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .with(req -> {
                            req.setRemoteAddr("203.0.113.9");
                            return req;
                        }))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Access denied from 203.0.113.9"))
                .andExpect(header().exists("X-Correlation-Id"));

        call(get("/api/order/1").header(HttpHeaders.AUTHORIZATION, token)).andExpect(status().isOk());
    }

    @Test
    void actuatorFromDisallowedOrigin_shouldBe403() throws Exception {
        mvc.perform(get("/actuator/circuitbreakers").header(HttpHeaders.ORIGIN, "https://elsewhere.example"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value(403));
    }

    @Test
    void declaredOversizedBody_shouldBe413BeforeDispatch() throws Exception {
        mvc.perform(post("/api/order/1")
                        .header(HttpHeaders.AUTHORIZATION, bearer("1", "user"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(new byte[2048]))
                .andExpect(request().asyncNotStarted())
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.status").value(413));

        mvc.perform(post("/auth/revoke")
                        .header(HttpHeaders.AUTHORIZATION, bearer("1", "user"))
                        .content(new byte[2048]))
                .andExpect(status().isPayloadTooLarge());

        verify(backend, never()).forward(any());
    }

    @Test
    void bodyWithinLimit_shouldBeForwarded() throws Exception {
        call(post("/api/order/1")
                .header(HttpHeaders.AUTHORIZATION, bearer("1", "user"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qty\":2}"))
                .andExpect(status().isOk());

        verify(backend).forward(argThat(sent -> new String(sent.body(), StandardCharsets.UTF_8).equals("{\"qty\":2}")));
    }

    @Test
    void corsPreflightFromAllowedOrigin_shouldBeAnswered() throws Exception {
        mvc.perform(options("/api/order/1")
                        .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"));
    }

    @Test
    void unknownPath_shouldBe404() throws Exception {
        call(get("/nothing/here").header(HttpHeaders.AUTHORIZATION, bearer("1", "user")))
                .andExpect(status().isNotFound())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON));
    }
}
