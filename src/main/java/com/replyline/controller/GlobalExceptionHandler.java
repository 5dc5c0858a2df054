package com.replyline.controller;

import com.replyline.exception.CompletionProviderException;
import com.replyline.exception.StreamDeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps request failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        log.debug("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(CompletionProviderException.class)
    public ResponseEntity<Map<String, String>> handleProvider(CompletionProviderException e) {
        HttpStatus status = switch (e.getCode()) {
            case CompletionProviderException.CIRCUIT_OPEN, CompletionProviderException.NO_PROVIDER ->
                    HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_GATEWAY;
        };
        log.warn("Provider failure ({}): {}", e.getCode(), e.getMessage());
        return error(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(StreamDeliveryException.class)
    public ResponseEntity<Map<String, String>> handleDelivery(StreamDeliveryException e) {
        log.warn("Delivery failure ({}): {}", e.getCode(), e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getCode(), e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "code", code,
                "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
