package com.example.render_tracker.config;

import com.example.render_tracker.util.RenderBackend;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and callback settings per render backend.
 */
@ConfigurationProperties(prefix = "render.backends")
public class RenderBackendProperties {

    private Backend serverless = new Backend("http://127.0.0.1:8100");
    private Backend gpu = new Backend("http://127.0.0.1:8000");
    private Backend local = new Backend("http://localhost:8000");

    public Backend getServerless() {
        return serverless;
    }

    public void setServerless(Backend serverless) {
        this.serverless = serverless;
    }

    public Backend getGpu() {
        return gpu;
    }

    public void setGpu(Backend gpu) {
        this.gpu = gpu;
    }

    public Backend getLocal() {
        return local;
    }

    public void setLocal(Backend local) {
        this.local = local;
    }

    public Backend forBackend(RenderBackend backend) {
        return switch (backend) {
            case SERVERLESS -> serverless;
            case GPU -> gpu;
            case LOCAL -> local;
        };
    }

    public static class Backend {
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private String callbackSecret = "";

        public Backend() {
        }

        public Backend(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public String getCallbackSecret() {
            return callbackSecret;
        }

        public void setCallbackSecret(String callbackSecret) {
            this.callbackSecret = callbackSecret;
        }
    }
}
