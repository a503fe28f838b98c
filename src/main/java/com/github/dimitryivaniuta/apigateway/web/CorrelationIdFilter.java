package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Accepts or generates X-Correlation-Id, echoes it and keeps it in the MDC.
 *
 * Runs on the async dispatch too (the id is kept as a request attribute), so error mapping after a
 * backend call still logs and reports the same id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final String ATTRIBUTE = CorrelationIdFilter.class.getName() + ".id";

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {

        String corr = (String) request.getAttribute(ATTRIBUTE);
        if (corr == null) {
            corr = request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
            if (corr == null || corr.isBlank()) corr = UUID.randomUUID().toString();
            request.setAttribute(ATTRIBUTE, corr);
            response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);
        }

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }
}
