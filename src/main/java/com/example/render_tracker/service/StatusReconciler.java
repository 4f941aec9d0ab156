package com.example.render_tracker.service;

import com.example.render_tracker.backend.BackendStatus;
import com.example.render_tracker.backend.CanonicalStatus;
import com.example.render_tracker.backend.RenderBackendAdapter;
import com.example.render_tracker.dto.JobStatusResponse;
import com.example.render_tracker.exception.UnsupportedJobMetadataException;
import com.example.render_tracker.model.BackendMetadata;
import com.example.render_tracker.model.RenderJob;
import com.example.render_tracker.storage.PresignedUrlResolver;
import com.example.render_tracker.store.JobSnapshot;
import com.example.render_tracker.store.JobStore;
import com.example.render_tracker.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Poll path: answers a status request from the store, consulting the job's render backend
 * while the job is still running and persisting any terminal state it learns about.
 * <p>
 * A failing backend query never fails the job and never fails the request; the caller
 * gets the stored state back and can poll again.
 */
@Service
public class StatusReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatusReconciler.class);

    static final String STEP_PROCESSING = "Processing";
    static final String STEP_CHECK_FAILED = "Processing (status check failed)";
    static final String STEP_FINALIZING = "Finalizing (waiting for output)";
    static final String DEFAULT_FAILURE = "Render failed";
    static final int FINALIZING_PROGRESS = 95;

    private final JobStore jobStore;
    private final RenderBackendAdapter backendAdapter;
    private final ProgressEstimator progressEstimator;
    private final CompletionTrigger completionTrigger;
    private final PresignedUrlResolver urlResolver;

    public StatusReconciler(JobStore jobStore,
                            RenderBackendAdapter backendAdapter,
                            ProgressEstimator progressEstimator,
                            CompletionTrigger completionTrigger,
                            PresignedUrlResolver urlResolver) {
        this.jobStore = jobStore;
        this.backendAdapter = backendAdapter;
        this.progressEstimator = progressEstimator;
        this.completionTrigger = completionTrigger;
        this.urlResolver = urlResolver;
    }

    public JobStatusResponse reconcile(String jobId) {
        JobSnapshot job = jobStore.get(jobId);
        if (job.isTerminal()) {
            return terminalView(job);
        }

        BackendMetadata metadata = job.metadata();
        Optional<BackendMetadata.CorrelationRef> ref = metadata.resolveCorrelation(jobId);
        if (ref.isEmpty()) {
            LOGGER.debug("No correlation id yet jobId={}", jobId);
            return JobStatusResponse.stored(job.status(), job.progress(), STEP_PROCESSING);
        }

        BackendStatus backendStatus;
        long start = System.currentTimeMillis();
        try {
            backendStatus = backendAdapter.query(metadata.backend(), ref.get().id());
        } catch (UnsupportedJobMetadataException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.warn("Backend status check failed jobId={} backend={} correlationId={} error={}",
                    jobId, metadata.backend(), ref.get().id(), ex.getMessage());
            return JobStatusResponse.stored(job.status(), job.progress(), STEP_CHECK_FAILED);
        }
        LOGGER.debug("Backend status jobId={} backend={} status={} ({} ms)",
                jobId, metadata.backend(), backendStatus.status(), System.currentTimeMillis() - start);

        CanonicalStatus status = backendStatus.status();
        if (backendStatus.missing() && ref.get().jobIdFallback()) {
            // fallback id not registered on the backend yet
            status = CanonicalStatus.QUEUED;
        }

        return switch (status) {
            case COMPLETED -> onBackendCompleted(jobId, backendStatus);
            case FAILED, ERROR -> onBackendFailed(job, backendStatus);
            case QUEUED, PROCESSING -> inProgress(job);
        };
    }

    private JobStatusResponse onBackendCompleted(String jobId, BackendStatus backendStatus) {
        JobSnapshot current = jobStore.get(jobId);
        if (current.isTerminal()) {
            return terminalView(current);
        }
        String outputRef = backendStatus.outputRef() != null ? backendStatus.outputRef() : current.outputRef();
        if (outputRef == null) {
            LOGGER.info("Backend reports completion without output yet jobId={}", jobId);
            return JobStatusResponse.processing(FINALIZING_PROGRESS, STEP_FINALIZING);
        }
        if (!RenderJob.fitsOutputRef(outputRef)) {
            LOGGER.warn("Backend output reference too long, job left unchanged jobId={} length={}", jobId, outputRef.length());
            return JobStatusResponse.stored(current.status(), current.progress(), STEP_CHECK_FAILED);
        }
        if (!jobStore.markCompleted(jobId, outputRef)) {
            return terminalView(jobStore.get(jobId));
        }
        LOGGER.info("Job completed via poll jobId={} outputRef={}", jobId, outputRef);
        completionTrigger.onCompleted(current.completed(outputRef));
        return JobStatusResponse.completed(urlResolver.resolve(outputRef));
    }

    private JobStatusResponse onBackendFailed(JobSnapshot job, BackendStatus backendStatus) {
        String error = RenderJob.clipErrorMessage(backendStatus.error() != null ? backendStatus.error() : DEFAULT_FAILURE);
        if (!jobStore.markFailed(job.id(), error)) {
            return terminalView(jobStore.get(job.id()));
        }
        LOGGER.warn("Job failed via poll jobId={} error={}", job.id(), error);
        completionTrigger.onFailed(job.failed(error));
        return JobStatusResponse.failed(error);
    }

    private JobStatusResponse inProgress(JobSnapshot job) {
        BackendMetadata metadata = job.metadata();
        Instant since = metadata.submittedAt() != null ? metadata.submittedAt() : job.createdAt();
        int progress = progressEstimator.estimate(metadata.backend(), since);
        return JobStatusResponse.processing(progress, "Rendering on " + metadata.backend().label());
    }

    private JobStatusResponse terminalView(JobSnapshot job) {
        if (job.status() == JobStatus.COMPLETED) {
            return JobStatusResponse.completed(urlResolver.resolve(job.outputRef()));
        }
        return JobStatusResponse.failed(job.errorMessage());
    }
}
