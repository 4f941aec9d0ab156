package com.example.render_tracker.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that map onto a fixed HTTP status.
 */
public abstract class ApiErrorException extends RuntimeException {
    private final HttpStatus status;

    protected ApiErrorException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected ApiErrorException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
