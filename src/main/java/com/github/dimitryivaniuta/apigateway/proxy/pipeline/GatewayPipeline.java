package com.github.dimitryivaniuta.apigateway.proxy.pipeline;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.admission.AccessPolicy;
import com.github.dimitryivaniuta.apigateway.proxy.admission.ClientAddressResolver;
import com.github.dimitryivaniuta.apigateway.proxy.admission.ClientIdentityResolver;
import com.github.dimitryivaniuta.apigateway.proxy.admission.PayloadSizeValidator;
import com.github.dimitryivaniuta.apigateway.proxy.admission.SourceAccessValidator;
import com.github.dimitryivaniuta.apigateway.proxy.auth.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.apigateway.proxy.auth.RequestAuthenticator;
import com.github.dimitryivaniuta.apigateway.proxy.backend.BackendClient;
import com.github.dimitryivaniuta.apigateway.proxy.backend.BackendRequest;
import com.github.dimitryivaniuta.apigateway.proxy.balancer.BackendSelector;
import com.github.dimitryivaniuta.apigateway.proxy.breaker.CallPermit;
import com.github.dimitryivaniuta.apigateway.proxy.breaker.CircuitBreakerService;
import com.github.dimitryivaniuta.apigateway.proxy.cache.CacheScope;
import com.github.dimitryivaniuta.apigateway.proxy.cache.RequestFingerprint;
import com.github.dimitryivaniuta.apigateway.proxy.cache.ResponseCache;
import com.github.dimitryivaniuta.apigateway.proxy.error.BackendErrorException;
import com.github.dimitryivaniuta.apigateway.proxy.error.BackendTimeoutException;
import com.github.dimitryivaniuta.apigateway.proxy.error.GatewayException;
import com.github.dimitryivaniuta.apigateway.proxy.error.RateLimitExceededException;
import com.github.dimitryivaniuta.apigateway.proxy.error.ServiceUnavailableException;
import com.github.dimitryivaniuta.apigateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.ClientIdentity;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.FixedWindowRateLimiter;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.RateLimitDecision;
import com.github.dimitryivaniuta.apigateway.proxy.routing.RouteTarget;
import com.github.dimitryivaniuta.apigateway.proxy.routing.ServiceRouter;
import com.github.dimitryivaniuta.apigateway.proxy.transform.ForwardHeaderTransformer;
import com.github.dimitryivaniuta.apigateway.proxy.transform.SensitiveDataFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.CACHE_STATUS_HEADER;
import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

/**
 * Per-request orchestration: source check, payload size, authentication, rate limit, access policy,
 * cache lookup, breaker gate, instance selection, forward, outcome recording, cache store.
 *
 * <p>Every step before the forward either passes or fails the returned future with a
 * {@link GatewayException} without touching any backend. Once a breaker permit has been taken its
 * outcome is recorded exactly once, whatever happens afterwards, including when the caller has gone away.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayPipeline {

    private final GatewayProperties props;
    private final Clock clock;
    private final ClientAddressResolver addressResolver;
    private final SourceAccessValidator sourceAccess;
    private final PayloadSizeValidator payloadSize;
    private final RequestAuthenticator authenticator;
    private final ClientIdentityResolver identityResolver;
    private final FixedWindowRateLimiter rateLimiter;
    private final AccessPolicy accessPolicy;
    private final ResponseCache responseCache;
    private final ServiceRouter router;
    private final CircuitBreakerService breakers;
    private final BackendSelector selector;
    private final BackendClient backendClient;
    private final ForwardHeaderTransformer headerTransformer;
    private final SensitiveDataFilter sensitiveDataFilter;
    private final GatewayMetrics metrics;

    public CompletableFuture<GatewayResponse> handle(GatewayRequest request) {
        try {
            return process(request);
        } catch (GatewayException e) {
            log.debug("Request rejected: method={}, path={}, reason={}, message={}",
                    request.method(), request.path(), e.reason(), e.getMessage());
            metrics.admissionRejected(e.reason());
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<GatewayResponse> process(GatewayRequest request) {
        // 1. source
        String clientIp = addressResolver.resolve(request);
        sourceAccess.validate(request, clientIp);

        // 2. payload
        payloadSize.validate(request);

        // 3. authentication
        AuthenticatedPrincipal principal = authenticator.authenticate(request);

        // 4. rate limit
        ClientIdentity identity = identityResolver.resolve(principal, clientIp);
        RateLimitDecision decision = rateLimiter.admit(identity, principal.tier(), clock.instant());
        if (!decision.allowed()) {
            metrics.rateLimitRejected(principal.tier().tag());
            throw new RateLimitExceededException("Rate limit exceeded", decision.retryAfter());
        }
        metrics.rateLimitAllowed(principal.tier().tag());

        accessPolicy.check(principal, request.path());

        // 5. cache
        String fingerprint = cacheable(request) ? fingerprint(request, identity) : null;
        if (fingerprint != null) {
            Optional<GatewayResponse> hit = responseCache.get(fingerprint, clock.instant());
            if (hit.isPresent()) {
                metrics.cacheHit();
                return CompletableFuture.completedFuture(hit.get().withHeader(CACHE_STATUS_HEADER, "HIT"));
            }
            metrics.cacheMiss();
        }

        // 6. breaker
        RouteTarget target = router.route(request.path(), request.headers());
        String service = target.service();
        CallPermit permit = breakers.tryAcquire(service)
                .orElseThrow(() -> new ServiceUnavailableException(
                        "Service temporarily unavailable: " + service,
                        breakers.retryAfter(service).orElse(null)));

        // 7. select and forward
        String instance;
        try {
            instance = selector.select(service, target.instances());
        } catch (RuntimeException e) {
            breakers.recordFailure(permit, e);
            throw e;
        }

        HttpHeaders outbound = headerTransformer.outbound(request.headers(), request.correlationId());
        BackendRequest call = new BackendRequest(service, instance, request.method(), request.pathAndQuery(), outbound, request.body());

        long started = System.nanoTime();
        CompletableFuture<GatewayResponse> inFlight;
        try {
            inFlight = backendClient.forward(call);
        } catch (RuntimeException e) {
            inFlight = CompletableFuture.failedFuture(e);
        }

        // 8. outcome; recorded on the backend future so a cancelled caller future cannot skip it
        CompletableFuture<GatewayResponse> result = new CompletableFuture<>();
        inFlight.whenComplete((response, error) -> {
            MDC.put(CORRELATION_ID_MDC_KEY, request.correlationId());
            try {
                result.complete(complete(call, permit, fingerprint, response, error, System.nanoTime() - started));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            } finally {
                MDC.remove(CORRELATION_ID_MDC_KEY);
            }
        });
        return result;
    }

    private GatewayResponse complete(BackendRequest call,
                                     CallPermit permit,
                                     String fingerprint,
                                     GatewayResponse response,
                                     Throwable error,
                                     long nanos) {
        String service = call.service();

        if (error != null) {
            Throwable cause = unwrap(error);
            boolean timeout = isTimeout(cause);
            breakers.recordFailure(permit, cause);
            metrics.backendCall(service, timeout ? "timeout" : "error", nanos);
            if (timeout) {
                log.warn("Backend timeout: service={}, instance={}", service, call.instanceUrl());
                throw new BackendTimeoutException("Service request timeout: " + service, cause);
            }
            log.warn("Backend call failed: service={}, instance={}, error={}", service, call.instanceUrl(), cause.toString());
            throw new BackendErrorException("Service request failed: " + service, cause);
        }

        if (response.status() >= 500) {
            BackendErrorException failure = new BackendErrorException(
                    "Service " + service + " answered " + response.status(), response.status());
            breakers.recordFailure(permit, failure);
            metrics.backendCall(service, "error", nanos);
            log.warn("Backend error status: service={}, instance={}, status={}", service, call.instanceUrl(), response.status());
            throw failure;
        }

        breakers.recordSuccess(permit);
        metrics.backendCall(service, "success", nanos);

        HttpHeaders headers = headerTransformer.inbound(response.headers());
        GatewayResponse relayed = new GatewayResponse(response.status(), headers, sensitiveDataFilter.filter(headers, response.body()));

        if (fingerprint == null) {
            return relayed;
        }
        if (relayed.is2xx()) {
            responseCache.put(fingerprint, relayed, clock.instant());
        }
        return relayed.withHeader(CACHE_STATUS_HEADER, "MISS");
    }

    private boolean cacheable(GatewayRequest request) {
        if (!responseCache.isEnabled() || !request.isGet()) return false;
        List<String> paths = props.getCache().getCacheablePaths();
        for (String p : paths) {
            if (request.path().startsWith(p)) return true;
        }
        return false;
    }

    private String fingerprint(GatewayRequest request, ClientIdentity identity) {
        GatewayProperties.Cache cfg = props.getCache();
        String subject = cfg.getScope() == CacheScope.SUBJECT ? identity.key() : null;
        return RequestFingerprint.of(request.method(), request.path(), request.rawQuery(),
                request.headers(), cfg.getVaryHeaders(), subject);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while ((c instanceof CompletionException || c instanceof ExecutionException) && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }

    private static boolean isTimeout(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof TimeoutException || c instanceof SocketTimeoutException || c instanceof HttpTimeoutException) {
                return true;
            }
            if (c.getCause() == c) break;
        }
        return false;
    }
}
