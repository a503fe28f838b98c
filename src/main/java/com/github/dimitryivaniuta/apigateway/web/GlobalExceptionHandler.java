package com.github.dimitryivaniuta.apigateway.web;

import com.github.dimitryivaniuta.apigateway.proxy.error.GatewayException;
import com.github.dimitryivaniuta.apigateway.proxy.error.RateLimitExceededException;
import com.github.dimitryivaniuta.apigateway.proxy.error.RetryAfter;
import com.github.dimitryivaniuta.apigateway.proxy.error.ServiceUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;

import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;
import static com.github.dimitryivaniuta.apigateway.proxy.web.RequestContextKeys.RETRY_AFTER_HEADER;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String message,
            String path,
            String correlationId
    ) {}

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGateway(GatewayException ex, HttpServletRequest req) {
        HttpHeaders h = new HttpHeaders();
        if (ex instanceof RateLimitExceededException rl) {
            h.set(RETRY_AFTER_HEADER, String.valueOf(rl.getRetryAfterSeconds())); // seconds per RFC
        } else if (ex instanceof ServiceUnavailableException su) {
            su.getRetryAfter().ifPresent(d -> h.set(RETRY_AFTER_HEADER, String.valueOf(RetryAfter.seconds(d))));
        }
        return new ResponseEntity<>(error(ex.getStatus(), ex.getMessage(), req), h, ex.getStatus());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(error(status, ex.getReason(), req));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, "Malformed request", req));
    }

    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<ApiError> handleAsyncTimeout(AsyncRequestTimeoutException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(error(HttpStatus.GATEWAY_TIMEOUT, "Service request timeout", req));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req));
    }

    private ApiError error(HttpStatus status, String message, HttpServletRequest req) {
        return new ApiError(
                clock.instant(),
                status.value(),
                status.getReasonPhrase(),
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                req.getRequestURI(),
                MDC.get(CORRELATION_ID_MDC_KEY)
        );
    }
}
