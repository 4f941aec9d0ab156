package com.example.render_tracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migration strategy for the render_job and completion_dispatch schema.
 */
@Configuration
public class FlywayConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(FlywayConfig.class);

    /**
     * Repairs checksum mismatches in the schema history, then migrates.
     * Disable with {@code render.flyway.repair-before-migrate=false} to get strict validation.
     */
    @Bean
    @ConditionalOnProperty(prefix = "render.flyway", name = "repair-before-migrate", havingValue = "true", matchIfMissing = true)
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            int applied = flyway.migrate().migrationsExecuted;
            LOGGER.info("Flyway repair+migrate done, migrationsExecuted={}", applied);
        };
    }
}
