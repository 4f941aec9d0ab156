package com.example.render_tracker.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a stored job carries backend metadata this service cannot interpret.
 */
public class UnsupportedJobMetadataException extends ApiErrorException {
    public UnsupportedJobMetadataException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }
}
