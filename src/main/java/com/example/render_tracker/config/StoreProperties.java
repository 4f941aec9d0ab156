package com.example.render_tracker.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry policy for job store reads and writes.
 */
@Validated
@ConfigurationProperties(prefix = "render.store")
public class StoreProperties {
    @Min(1)
    private int maxAttempts = 3;
    private Duration backoff = Duration.ofMillis(100);

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
        return backoff;
    }

    public void setBackoff(Duration backoff) {
        this.backoff = backoff;
    }
}
