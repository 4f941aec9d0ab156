package com.example.render_tracker.dto;

import com.example.render_tracker.util.JobStatus;

/**
 * Poll answer. {@code status} is one of processing, completed, failed.
 */
public record JobStatusResponse(
        String status,
        int progress,
        String currentStep,
        String outputUrl,
        String error
) {
    public static JobStatusResponse completed(String outputUrl) {
        return new JobStatusResponse(JobStatus.COMPLETED.apiValue(), 100, "Completed", outputUrl, null);
    }

    public static JobStatusResponse failed(String error) {
        return new JobStatusResponse(JobStatus.FAILED.apiValue(), 0, "Failed", null, error);
    }

    public static JobStatusResponse processing(int progress, String currentStep) {
        return new JobStatusResponse(JobStatus.PROCESSING.apiValue(), progress, currentStep, null, null);
    }

    public static JobStatusResponse stored(JobStatus status, int progress, String currentStep) {
        return new JobStatusResponse(status.apiValue(), progress, currentStep, null, null);
    }
}
