package com.example.render_tracker.backend;

/**
 * Backend-independent job status vocabulary.
 */
public enum CanonicalStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    ERROR;

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }
}
