package com.example.render_tracker.dto;

import com.example.render_tracker.model.CompletionDispatch;
import com.example.render_tracker.util.DispatchKind;
import com.example.render_tracker.util.DispatchStatus;

import java.time.Instant;
import java.util.UUID;

public record DispatchResponse(
        UUID id,
        String jobId,
        DispatchKind kind,
        DispatchStatus status,
        int attempts,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    public static DispatchResponse from(CompletionDispatch d) {
        return new DispatchResponse(d.getId(), d.getJobId(), d.getKind(), d.getStatus(),
                d.getAttempts(), d.getLastError(), d.getCreatedAt(), d.getUpdatedAt());
    }
}
