package com.example.render_tracker.model;

import com.example.render_tracker.util.JobKind;
import com.example.render_tracker.util.JobStatus;
import com.example.render_tracker.util.RenderBackend;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(
        name = "render_job",
        indexes = {
                @Index(name = "idx_render_job_status_created", columnList = "status, created_at")
        }
)
public class RenderJob {
    public static final int MAX_OUTPUT_REF_LENGTH = 2048;
    public static final int MAX_ERROR_MESSAGE_LENGTH = 4000;

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "progress", nullable = false)
    private int progress = 0;

    @Column(name = "output_ref", length = MAX_OUTPUT_REF_LENGTH)
    private String outputRef;

    @Column(name = "error_message", length = MAX_ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    // Stored as text and parsed on read so unknown values fail closed.
    @Column(name = "backend", nullable = false, length = 32)
    private String backend;

    @Column(name = "correlation_id", length = 255)
    private String correlationId;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "job_kind", nullable = false, length = 32)
    private String jobKind;

    @Column(name = "auto_publish", nullable = false)
    private boolean autoPublish;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    protected RenderJob() {}

    public RenderJob(String id, RenderBackend backend, JobKind jobKind) {
        this.id = id;
        this.backend = backend.name();
        this.jobKind = jobKind.name();
    }

    public String getId() {
        return id;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public String getOutputRef() {
        return outputRef;
    }

    public void setOutputRef(String outputRef) {
        this.outputRef = outputRef;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Sets the backend correlation id. Once a value is stored it is never replaced.
     */
    public void setCorrelationId(String correlationId) {
        if (this.correlationId != null && !this.correlationId.equals(correlationId)) {
            throw new IllegalStateException("correlationId already set for job " + id);
        }
        this.correlationId = correlationId;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public void setSubmittedAt(Instant submittedAt) {
        this.submittedAt = submittedAt;
    }

    public String getJobKind() {
        return jobKind;
    }

    public void setJobKind(String jobKind) {
        this.jobKind = jobKind;
    }

    public boolean isAutoPublish() {
        return autoPublish;
    }

    public void setAutoPublish(boolean autoPublish) {
        this.autoPublish = autoPublish;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = JobStatus.PENDING;
    }

    /** Cuts a failure text to what the error_message column holds. */
    public static String clipErrorMessage(String error) {
        if (error == null || error.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }

    public static boolean fitsOutputRef(String outputRef) {
        return outputRef == null || outputRef.length() <= MAX_OUTPUT_REF_LENGTH;
    }
}
