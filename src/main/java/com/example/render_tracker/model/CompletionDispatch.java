package com.example.render_tracker.model;

import com.example.render_tracker.util.DispatchKind;
import com.example.render_tracker.util.DispatchStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One attempt to notify a downstream system about a finished render.
 */
@Entity
@Table(
        name = "completion_dispatch",
        indexes = {
                @Index(name = "idx_completion_dispatch_job", columnList = "job_id, created_at")
        }
)
public class CompletionDispatch {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private DispatchKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private DispatchStatus status = DispatchStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected CompletionDispatch() {}

    public CompletionDispatch(String jobId, DispatchKind kind, Instant now) {
        this.jobId = jobId;
        this.kind = kind;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public UUID getId() {
        return id;
    }

    public String getJobId() {
        return jobId;
    }

    public DispatchKind getKind() {
        return kind;
    }

    public DispatchStatus getStatus() {
        return status;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void markSucceeded(Instant now) {
        this.attempts++;
        this.status = DispatchStatus.SUCCEEDED;
        this.lastError = null;
        this.updatedAt = now;
    }

    public void markFailed(String error, Instant now) {
        this.attempts++;
        this.status = DispatchStatus.FAILED;
        this.lastError = error == null ? null : (error.length() > 2000 ? error.substring(0, 2000) : error);
        this.updatedAt = now;
    }
}
