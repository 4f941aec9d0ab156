package com.example.render_tracker.model;

import com.example.render_tracker.exception.UnsupportedJobMetadataException;
import com.example.render_tracker.util.JobKind;
import com.example.render_tracker.util.RenderBackend;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Optional;

/**
 * Identifies where a job runs and how to find it on that backend.
 *
 * @param backend        variant that executes the job
 * @param correlationId  backend-native job id, absent until the submission path stores it
 * @param submittedAt    time the job was handed to the backend
 * @param jobKind        render kind discriminator
 * @param autoPublish    whether a successful render should start auto-publishing
 */
public record BackendMetadata(
        RenderBackend backend,
        @Nullable String correlationId,
        @Nullable Instant submittedAt,
        JobKind jobKind,
        boolean autoPublish
) {

    public BackendMetadata {
        if (backend == null) throw new IllegalArgumentException("backend is required");
        if (jobKind == null) throw new IllegalArgumentException("jobKind is required");
        if (correlationId != null && correlationId.isBlank()) correlationId = null;
    }

    /**
     * Builds metadata from stored column values, refusing anything it does not recognise.
     */
    public static BackendMetadata fromStored(String jobId,
                                             @Nullable String backendTag,
                                             @Nullable String correlationId,
                                             @Nullable Instant submittedAt,
                                             @Nullable String jobKindTag,
                                             boolean autoPublish) {
        RenderBackend backend = RenderBackend.fromTag(backendTag)
                .orElseThrow(() -> new UnsupportedJobMetadataException(
                        "Unsupported render backend '%s' on job %s".formatted(backendTag, jobId)));
        JobKind kind = JobKind.fromTag(jobKindTag)
                .orElseThrow(() -> new UnsupportedJobMetadataException(
                        "Unsupported job kind '%s' on job %s".formatted(jobKindTag, jobId)));
        return new BackendMetadata(backend, correlationId, submittedAt, kind, autoPublish);
    }

    /**
     * Picks the id to query the backend with: the stored correlation id, or the job id
     * itself when the job kind allows it.
     */
    public Optional<CorrelationRef> resolveCorrelation(String jobId) {
        if (correlationId != null) {
            return Optional.of(new CorrelationRef(correlationId, false));
        }
        if (jobKind.allowsJobIdFallback() && jobId != null && !jobId.isBlank()) {
            return Optional.of(new CorrelationRef(jobId, true));
        }
        return Optional.empty();
    }

    public record CorrelationRef(String id, boolean jobIdFallback) {
    }
}
