package com.example.render_tracker.storage;

import org.springframework.lang.Nullable;

/**
 * Turns a stored output reference into a time-limited URL a client can fetch.
 */
public interface PresignedUrlResolver {

    /**
     * @param outputRef storage URL or object key, may be null
     * @return a time-limited URL, the reference unchanged when it does not point into our storage, or null
     */
    @Nullable
    String resolve(@Nullable String outputRef);
}
