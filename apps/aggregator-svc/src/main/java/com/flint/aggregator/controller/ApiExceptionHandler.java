package com.flint.aggregator.controller;

import com.flint.aggregator.connection.ConnectionErrorClassifier;
import com.flint.aggregator.connection.ConnectionVerdict;
import com.flint.aggregator.connection.ProviderException;
import com.flint.aggregator.controller.dto.ErrorResponseDto;
import com.flint.aggregator.security.CurrentUserProvider;
import com.flint.aggregator.security.RequestContextHolder;
import com.flint.aggregator.snapshot.SnapshotAggregationException;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final ConnectionErrorClassifier classifier;

    public ApiExceptionHandler(ConnectionErrorClassifier classifier) {
        this.classifier = classifier;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(CurrentUserProvider.MissingUserException.class)
    public ResponseEntity<ErrorResponseDto> handleMissingUser(CurrentUserProvider.MissingUserException ex) {
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", "Authentication required", Map.of());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(NoSuchElementException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), Map.of());
    }

    // --- Upstream provider mapping: the caller only ever sees the short verdict message ---
    @ExceptionHandler({ProviderException.class, WebClientResponseException.class, WebClientRequestException.class})
    public ResponseEntity<ErrorResponseDto> handleProvider(RuntimeException ex) {
        ConnectionVerdict verdict = classifier.classify(ex);
        log.warn("Provider call failed: {}", ex.toString());
        Map<String, Object> details = new HashMap<>();
        details.put("retryable", verdict.shouldRetry());
        details.put("reconnectRequired", verdict.shouldMarkDisconnected());
        return build(statusFor(verdict), verdict.errorCode(), verdict.userMessage(), details);
    }

    @ExceptionHandler(SnapshotAggregationException.class)
    public ResponseEntity<ErrorResponseDto> handleSnapshot(SnapshotAggregationException ex) {
        ConnectionVerdict verdict = ex.getFailures().get(0).verdict();
        return build(statusFor(verdict), verdict.errorCode(), verdict.userMessage(),
                Map.of("failedConnections", ex.getFailures().size()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled request failure", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of());
    }

    private static HttpStatus statusFor(ConnectionVerdict verdict) {
        if (verdict.shouldMarkDisconnected()) {
            return HttpStatus.CONFLICT;
        }
        return verdict.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
