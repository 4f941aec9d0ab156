package com.example.render_tracker.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Downstream notification targets and the thread pool that delivers them.
 */
@Validated
@ConfigurationProperties(prefix = "render.dispatch")
public class DispatchProperties {

    @Min(1)
    private int executorThreads = 2;
    @Min(0)
    private int executorQueueCapacity = 100;
    private Duration timeout = Duration.ofSeconds(10);

    /** Base URL of the app that owns auto-scheduling. */
    @NotBlank
    private String publishBaseUrl = "http://localhost:3000";

    /** Base URL of the creation-session service; blank disables session notifications. */
    private String sessionBaseUrl = "";

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getPublishBaseUrl() {
        return publishBaseUrl;
    }

    public void setPublishBaseUrl(String publishBaseUrl) {
        this.publishBaseUrl = publishBaseUrl;
    }

    public String getSessionBaseUrl() {
        return sessionBaseUrl;
    }

    public void setSessionBaseUrl(String sessionBaseUrl) {
        this.sessionBaseUrl = sessionBaseUrl;
    }
}
