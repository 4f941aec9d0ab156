package com.example.render_tracker.exception;

/**
 * A downstream notification could not be delivered.
 */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
