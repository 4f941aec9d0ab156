package com.example.render_tracker.backend;

import com.example.render_tracker.exception.BackendQueryException;
import com.example.render_tracker.util.RenderBackend;

/**
 * Status query capability of one render backend.
 */
public interface RenderBackendClient {

    RenderBackend backend();

    /**
     * Asks the backend for the current state of a job.
     *
     * @throws BackendQueryException when the backend cannot be reached or answers with an error
     */
    BackendStatus query(String correlationId);
}
