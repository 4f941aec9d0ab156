package com.example.render_tracker.exception;

import com.example.render_tracker.util.RenderBackend;

/**
 * Transient failure while asking a render backend for a job's status.
 */
public class BackendQueryException extends RuntimeException {
    private final RenderBackend backend;

    public BackendQueryException(RenderBackend backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendQueryException(RenderBackend backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public RenderBackend getBackend() {
        return backend;
    }
}
