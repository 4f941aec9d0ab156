package com.example.render_tracker.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallbackResponse(
        String status,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("updated_status") String updatedStatus,
        String message
) {
    public static final String OK = "ok";
    public static final String SKIPPED = "skipped";

    public static CallbackResponse ok(String jobId, String updatedStatus) {
        return new CallbackResponse(OK, jobId, updatedStatus, null);
    }

    public static CallbackResponse skipped(String message) {
        return new CallbackResponse(SKIPPED, null, null, message);
    }
}
