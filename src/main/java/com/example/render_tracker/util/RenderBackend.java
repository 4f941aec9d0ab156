package com.example.render_tracker.util;

import java.util.Locale;
import java.util.Optional;

/**
 * Compute backends a render job can run on.
 */
public enum RenderBackend {
    SERVERLESS("Serverless"),
    GPU("GPU"),
    LOCAL("Local");

    private final String label;

    RenderBackend(String label) {
        this.label = label;
    }

    /** Human readable name used in step labels. */
    public String label() {
        return label;
    }

    public static Optional<RenderBackend> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(RenderBackend.valueOf(tag.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
