package com.example.render_tracker.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables the reconciliation settings and provides the shared clock.
 */
@Configuration
@EnableConfigurationProperties({ProgressProperties.class, StoreProperties.class, StorageProperties.class})
public class AppConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
