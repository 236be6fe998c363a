package com.signalplatform.signal.controller;

import com.signalplatform.common.exception.CacheUnpopulatedException;
import com.signalplatform.signal.controller.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps read-path exceptions to {@code {"error": ...}} bodies.
 *
 * <pre>
 *   CacheUnpopulatedException  → 503 (no cycle published yet)
 *   IllegalArgumentException   → 400 (e.g. unknown source kind)
 *   ResponseStatusException    → its own status (bad query parameter, unknown route)
 *   anything else              → 500
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CacheUnpopulatedException.class)
    public ResponseEntity<ErrorResponse> handleUnpopulated(CacheUnpopulatedException ex) {
        log.warn("Read before first refresh: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        log.warn("Request rejected: status={} reason={}", ex.getStatusCode().value(), ex.getReason());
        String reason = ex.getReason() != null ? ex.getReason() : ex.getStatusCode().toString();
        return ResponseEntity.status(ex.getStatusCode()).body(new ErrorResponse(reason));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception on read path", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Unexpected error: " + ex.getMessage()));
    }
}
