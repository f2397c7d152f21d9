package com.deepansh.policyradar.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the typed exception hierarchy to JSON error bodies for the synchronous API.
 * Streamed chats report errors as SSE events instead and never reach this class.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /** Non-standard "client closed request" status, as used by nginx. */
    static final int CLIENT_CLOSED_REQUEST = 499;

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitException ex) {
        log.warn("Upstream rate limit: {} [retryAfter={}]", ex.getMessage(), ex.getRetryAfterSeconds());
        Map<String, Object> body = errorBody(ex.getMessage());
        body.put("retry_after", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApi(ApiException ex) {
        log.error("Upstream API error [status={}]: {}", ex.getStatusCode(), ex.getMessage());
        Map<String, Object> body = errorBody(ex.getMessage());
        body.put("status", ex.getStatusCode());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode());
        return ResponseEntity.status(status != null ? status : HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(RequestValidationException ex) {
        log.info("Rejected chat request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler(ChatCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(ChatCancelledException ex) {
        log.info("Chat cancelled [requestId={}]", ex.getRequestId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("cancelled", true);
        body.put("request_id", ex.getRequestId());
        return ResponseEntity.status(CLIENT_CLOSED_REQUEST).body(body);
    }

    @ExceptionHandler(RadarException.class)
    public ResponseEntity<Map<String, Object>> handleRadar(RadarException ex) {
        log.error("Engine error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorBody(ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(errorBody(msg));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred"));
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
