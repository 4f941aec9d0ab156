package com.example.render_tracker.exception;

import org.springframework.http.HttpStatus;

public class JobNotFoundException extends ApiErrorException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super(HttpStatus.NOT_FOUND, "Job not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
