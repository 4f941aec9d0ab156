package com.example.render_tracker.util;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminator for the kind of render a job represents.
 * <p>
 * AI video kinds are submitted with the job id doubling as the backend job id, so the
 * job id can stand in for a correlation id that has not been persisted yet.
 */
public enum JobKind {
    FAST_CUT(false),
    IMAGE_TO_VIDEO(true),
    VIDEO_GENERATION(true);

    private final boolean jobIdFallback;

    JobKind(boolean jobIdFallback) {
        this.jobIdFallback = jobIdFallback;
    }

    public boolean allowsJobIdFallback() {
        return jobIdFallback;
    }

    public static Optional<JobKind> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JobKind.valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
