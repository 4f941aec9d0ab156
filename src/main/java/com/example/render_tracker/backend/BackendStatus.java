package com.example.render_tracker.backend;

import org.springframework.lang.Nullable;

/**
 * Answer of a render backend status query.
 *
 * @param status         canonical status
 * @param outputRef      artifact reference, when the backend reports one
 * @param error          failure text, when the backend reports one
 * @param correlationId  id the backend was queried with
 * @param missing        true when the backend answered that it does not know the id
 */
public record BackendStatus(
        CanonicalStatus status,
        @Nullable String outputRef,
        @Nullable String error,
        String correlationId,
        boolean missing
) {
    public static BackendStatus of(CanonicalStatus status, @Nullable String outputRef, @Nullable String error, String correlationId) {
        return new BackendStatus(status, blankToNull(outputRef), blankToNull(error), correlationId, false);
    }

    public static BackendStatus missing(String correlationId) {
        return new BackendStatus(CanonicalStatus.ERROR, null, "Job " + correlationId + " not found", correlationId, true);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
