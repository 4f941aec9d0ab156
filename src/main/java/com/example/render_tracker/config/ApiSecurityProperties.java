package com.example.render_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "render.security")
public class ApiSecurityProperties {

    /** Bearer tokens accepted on the job API. Empty means every protected request is rejected. */
    private List<String> apiTokens = new ArrayList<>();

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("http://localhost:*"));

    public List<String> getApiTokens() {
        return apiTokens;
    }

    public void setApiTokens(List<String> apiTokens) {
        this.apiTokens = apiTokens;
    }

    public List<String> getAllowedOriginPatterns() {
        return allowedOriginPatterns;
    }

    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }
}
