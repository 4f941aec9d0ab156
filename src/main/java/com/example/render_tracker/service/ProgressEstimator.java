package com.example.render_tracker.service;

import com.example.render_tracker.config.ProgressProperties;
import com.example.render_tracker.util.RenderBackend;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Advisory completion percentage for in-flight renders, derived only from elapsed time.
 * Never returns 100; that value belongs to the real COMPLETED transition.
 */
@Component
public class ProgressEstimator {
    static final int MAX_ESTIMATE = 99;

    private final ProgressProperties properties;
    private final Clock clock;

    public ProgressEstimator(ProgressProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public int estimate(RenderBackend backend, @Nullable Instant submittedAt) {
        if (submittedAt == null) {
            return clamp(properties.getUnknownElapsedProgress());
        }
        Duration elapsed = Duration.between(submittedAt, clock.instant());
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        return switch (backend) {
            case GPU -> clamp(twoPhase(properties.getGpu(), elapsed));
            case SERVERLESS -> clamp(linear(properties.getServerless(), elapsed));
            case LOCAL -> clamp(linear(properties.getLocal(), elapsed));
        };
    }

    private static int twoPhase(ProgressProperties.TwoPhase p, Duration elapsed) {
        long coldMs = Math.max(1, p.getColdStart().toMillis());
        long renderMs = Math.max(1, p.getRender().toMillis());
        long elapsedMs = elapsed.toMillis();
        if (elapsedMs < coldMs) {
            int span = p.getRenderFloor() - p.getColdStartFloor();
            return p.getColdStartFloor() + (int) Math.floor((double) elapsedMs / coldMs * span);
        }
        int span = p.getCeiling() - p.getRenderFloor();
        int ramp = (int) Math.floor((double) (elapsedMs - coldMs) / renderMs * span);
        return p.getRenderFloor() + Math.min(span, ramp);
    }

    private static int linear(ProgressProperties.Linear p, Duration elapsed) {
        long expectedMs = Math.max(1, p.getExpected().toMillis());
        int span = p.getCeiling() - p.getFloor();
        int ramp = (int) Math.floor((double) elapsed.toMillis() / expectedMs * span);
        return p.getFloor() + Math.min(span, ramp);
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(MAX_ESTIMATE, value));
    }
}
