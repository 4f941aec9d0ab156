package com.example.render_tracker.store;

import com.example.render_tracker.model.BackendMetadata;
import com.example.render_tracker.util.JobStatus;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Immutable view of a render job as read from the store.
 */
public record JobSnapshot(
        String id,
        JobStatus status,
        int progress,
        @Nullable String outputRef,
        @Nullable String errorMessage,
        BackendMetadata metadata,
        @Nullable Instant createdAt,
        @Nullable Instant updatedAt
) {
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public JobSnapshot completed(String outputRef) {
        return new JobSnapshot(id, JobStatus.COMPLETED, 100, outputRef, null, metadata, createdAt, updatedAt);
    }

    public JobSnapshot failed(String errorMessage) {
        return new JobSnapshot(id, JobStatus.FAILED, 0, null, errorMessage, metadata, createdAt, updatedAt);
    }
}
