package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.admission.ClientAddressResolver;
import com.github.dimitryivaniuta.apigateway.proxy.admission.PayloadSizeValidator;
import com.github.dimitryivaniuta.apigateway.proxy.admission.SourceAccessValidator;
import com.github.dimitryivaniuta.apigateway.proxy.error.GatewayException;
import com.github.dimitryivaniuta.apigateway.proxy.metrics.GatewayMetrics;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.IOException;

import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

/**
 * Source allow-lists and the declared payload size, applied to every request before any body is
 * read, so {@code /auth/*} and actuator endpoints are covered as well as proxied routes.
 *
 * <p>Rejections are rendered by {@link GlobalExceptionHandler}, like any other gateway error.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 25)
public class AdmissionFilter extends OncePerRequestFilter {

    private final ClientAddressResolver addressResolver;
    private final SourceAccessValidator sourceAccess;
    private final PayloadSizeValidator payloadSize;
    private final GatewayMetrics metrics;
    private final HandlerExceptionResolver exceptionResolver;

    public AdmissionFilter(ClientAddressResolver addressResolver,
                           SourceAccessValidator sourceAccess,
                           PayloadSizeValidator payloadSize,
                           GatewayMetrics metrics,
                           @Qualifier("handlerExceptionResolver") HandlerExceptionResolver exceptionResolver) {
        this.addressResolver = addressResolver;
        this.sourceAccess = sourceAccess;
        this.payloadSize = payloadSize;
        this.metrics = metrics;
        this.exceptionResolver = exceptionResolver;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        // headers only; the body stays unread
        GatewayRequest head = new GatewayRequest(
                request.getMethod(),
                request.getRequestURI(),
                request.getQueryString(),
                new ServletServerHttpRequest(request).getHeaders(),
                null,
                request.getRemoteAddr(),
                MDC.get(CORRELATION_ID_MDC_KEY));
        try {
            sourceAccess.validate(head, addressResolver.resolve(head));
            payloadSize.validate(head);
        } catch (GatewayException e) {
            log.debug("Request refused before dispatch: method={}, path={}, reason={}",
                    head.method(), head.path(), e.reason());
            metrics.admissionRejected(e.reason());
            exceptionResolver.resolveException(request, response, null, e);
            return;
        }
        chain.doFilter(request, response);
    }
}
