package com.example.render_tracker.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completion notice pushed by a render backend.
 */
public record CallbackRequest(
        @JsonProperty("job_id") String jobId,
        String status,
        @JsonProperty("output_url") @JsonAlias("output_ref") String outputUrl,
        String error,
        String secret
) {
}
