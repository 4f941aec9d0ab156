package com.example.render_tracker.util;

import java.util.Locale;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Status as exposed to polling clients. PENDING and PROCESSING both read as "processing".
     */
    public String apiValue() {
        return this == PENDING ? "processing" : name().toLowerCase(Locale.ROOT);
    }
}
