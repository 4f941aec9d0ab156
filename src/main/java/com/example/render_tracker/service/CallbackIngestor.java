package com.example.render_tracker.service;

import com.example.render_tracker.dto.CallbackRequest;
import com.example.render_tracker.dto.CallbackResponse;
import com.example.render_tracker.exception.CallbackAuthenticationException;
import com.example.render_tracker.exception.CallbackValidationException;
import com.example.render_tracker.model.RenderJob;
import com.example.render_tracker.store.JobSnapshot;
import com.example.render_tracker.store.JobStore;
import com.example.render_tracker.util.RenderBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Push path: applies a backend's completion notice to the store.
 * Replays and notices for already-finished jobs are acknowledged without effect.
 */
@Service
public class CallbackIngestor {
    private static final Logger LOGGER = LoggerFactory.getLogger(CallbackIngestor.class);

    static final String ALREADY_PROCESSED = "Already processed";

    private final CallbackSecretVerifier secretVerifier;
    private final JobStore jobStore;
    private final CompletionTrigger completionTrigger;

    public CallbackIngestor(CallbackSecretVerifier secretVerifier,
                            JobStore jobStore,
                            CompletionTrigger completionTrigger) {
        this.secretVerifier = secretVerifier;
        this.jobStore = jobStore;
        this.completionTrigger = completionTrigger;
    }

    public CallbackResponse ingest(CallbackRequest request) {
        RenderBackend source = secretVerifier.verify(request == null ? null : request.secret())
                .orElseThrow(() -> {
                    LOGGER.warn("Rejected callback with invalid secret");
                    return new CallbackAuthenticationException();
                });

        String jobId = trimToNull(request.jobId());
        String status = trimToNull(request.status());
        if (jobId == null || status == null) {
            throw new CallbackValidationException("Missing job_id or status");
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        if (!normalized.equals("completed") && !normalized.equals("failed")) {
            throw new CallbackValidationException("Invalid status: " + status);
        }

        LOGGER.info("Callback received jobId={} status={} source={}", jobId, normalized, source);
        JobSnapshot job = jobStore.get(jobId);
        if (job.isTerminal()) {
            LOGGER.info("Callback for finished job ignored jobId={} stored={}", jobId, job.status());
            return CallbackResponse.skipped(ALREADY_PROCESSED);
        }

        if (normalized.equals("completed")) {
            String outputRef = trimToNull(request.outputUrl());
            if (outputRef == null) {
                LOGGER.warn("Completed callback without output_url, job left unchanged jobId={}", jobId);
                return CallbackResponse.ok(jobId, job.status().name());
            }
            if (!RenderJob.fitsOutputRef(outputRef)) {
                throw new CallbackValidationException("output_url exceeds " + RenderJob.MAX_OUTPUT_REF_LENGTH + " characters");
            }
            if (!jobStore.markCompleted(jobId, outputRef)) {
                return CallbackResponse.skipped(ALREADY_PROCESSED);
            }
            LOGGER.info("Job completed via callback jobId={} outputRef={}", jobId, outputRef);
            completionTrigger.onCompleted(job.completed(outputRef));
        } else {
            String error = trimToNull(request.error());
            if (error == null) {
                error = StatusReconciler.DEFAULT_FAILURE;
            }
            error = RenderJob.clipErrorMessage(error);
            if (!jobStore.markFailed(jobId, error)) {
                return CallbackResponse.skipped(ALREADY_PROCESSED);
            }
            LOGGER.warn("Job failed via callback jobId={} error={}", jobId, error);
            completionTrigger.onFailed(job.failed(error));
        }
        return CallbackResponse.ok(jobId, jobStore.get(jobId).status().name());
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
