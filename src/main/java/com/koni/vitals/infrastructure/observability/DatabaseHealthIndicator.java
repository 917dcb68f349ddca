package com.koni.vitals.infrastructure.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Health indicator for the relational store holding the audit log and device registry.
 *
 * Readings cannot be acknowledged without it, so a DOWN status here means ingestion
 * answers 503 and Kafka deliveries go to the dead letter topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseHealthIndicator implements HealthIndicator {

    static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;

    @Override
    public Health health() {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                log.error("Database health check failed: connection did not validate within {}s",
                    VALIDATION_TIMEOUT_SECONDS);
                return Health.down()
                        .withDetail("error", "ConnectionInvalid")
                        .withDetail("message", "Connection did not validate within " + VALIDATION_TIMEOUT_SECONDS + "s")
                        .build();
            }

            DatabaseMetaData metaData = connection.getMetaData();
            log.debug("Database health check passed: product={}, version={}",
                metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion());

            return Health.up()
                    .withDetail("database", metaData.getDatabaseProductName())
                    .withDetail("version", metaData.getDatabaseProductVersion())
                    .build();
        } catch (SQLException e) {
            log.error("Database health check failed", e);
            return Health.down()
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", e.getMessage())
                    .build();
        }
    }
}
