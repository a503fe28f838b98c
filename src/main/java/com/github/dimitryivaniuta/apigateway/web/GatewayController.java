package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.admission.PayloadSizeValidator;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayPipeline;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayRequest;
import com.github.dimitryivaniuta.apigateway.proxy.pipeline.GatewayResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

/**
 * Catch-all entry point. Everything not mapped more specifically (actuator, /auth/*) goes through
 * the gateway pipeline; the servlet thread is released while the backend call runs.
 */
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayPipeline pipeline;
    private final PayloadSizeValidator payloadSize;

    @RequestMapping(value = "/**", method = {
            RequestMethod.GET, RequestMethod.HEAD, RequestMethod.POST,
            RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE
    })
    public CompletableFuture<ResponseEntity<byte[]>> proxy(HttpServletRequest request) throws IOException {
        byte[] body = payloadSize.readBody(request.getInputStream());
        HttpHeaders headers = new ServletServerHttpRequest(request).getHeaders();
        String path = request.getRequestURI().substring(request.getContextPath().length());

        GatewayRequest gatewayRequest = new GatewayRequest(
                request.getMethod(),
                path,
                request.getQueryString(),
                headers,
                body,
                request.getRemoteAddr(),
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
        return pipeline.handle(gatewayRequest).thenApply(GatewayController::toEntity);
    }

    private static ResponseEntity<byte[]> toEntity(GatewayResponse r) {
        return ResponseEntity.status(r.status()).headers(r.headers()).body(r.body());
    }
}
