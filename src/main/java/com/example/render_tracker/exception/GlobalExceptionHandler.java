package com.example.render_tracker.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Renders every failure as {@code {"detail": "..."}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ApiErrorException.class)
    public ResponseEntity<Map<String, Object>> handleApiError(ApiErrorException exception) {
        if (exception.getStatus().is5xxServerError()) {
            LOGGER.error("Request failed status={} message={}", exception.getStatus().value(), exception.getMessage(), exception);
            return detail(exception.getStatus(), "Internal server error");
        }
        return detail(exception.getStatus(), exception.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException exception) {
        LOGGER.warn("Malformed request body: {}", exception.getMostSpecificCause().getMessage());
        return detail(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        if (exception instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            String reason = errorResponse.getBody().getDetail();
            return detail(status, reason == null ? "Request failed" : reason);
        }
        LOGGER.error("Unexpected failure", exception);
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> detail(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
