package com.example.render_tracker.service;

import com.example.render_tracker.config.RenderBackendProperties;
import com.example.render_tracker.util.RenderBackend;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Matches a callback's shared secret against the configured per-backend secrets.
 */
@Component
public class CallbackSecretVerifier {

    private final RenderBackendProperties properties;

    public CallbackSecretVerifier(RenderBackendProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the backend whose secret matched, empty when none did
     */
    public Optional<RenderBackend> verify(String secret) {
        if (secret == null || secret.isEmpty()) {
            return Optional.empty();
        }
        byte[] presented = secret.getBytes(StandardCharsets.UTF_8);
        RenderBackend matched = null;
        // check every backend so timing does not reveal which one matched
        for (RenderBackend backend : RenderBackend.values()) {
            String configured = properties.forBackend(backend).getCallbackSecret();
            if (configured == null || configured.isBlank()) {
                continue;
            }
            if (MessageDigest.isEqual(presented, configured.getBytes(StandardCharsets.UTF_8)) && matched == null) {
                matched = backend;
            }
        }
        return Optional.ofNullable(matched);
    }
}
