package com.example.render_tracker.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(2);

    @Bean
    public HealthIndicator serverlessBackendHealth(@Qualifier("serverlessWebClient") WebClient client) {
        return probe(client, "serverless");
    }

    @Bean
    public HealthIndicator gpuBackendHealth(@Qualifier("gpuWebClient") WebClient client) {
        return probe(client, "gpu");
    }

    @Bean
    public HealthIndicator localBackendHealth(@Qualifier("localWebClient") WebClient client) {
        return probe(client, "local");
    }

    static HealthIndicator probe(WebClient client, String name) {
        return () -> {
            try {
                // lightweight check, HEAD / must answer
                client.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(PROBE_TIMEOUT);
                return Health.up().withDetail(name, "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail(name, "unreachable").build();
            }
        };
    }
}
