package com.hal9001.backend.global.datasource;

import java.sql.SQLException;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports which backend is serving and whether it can hand out a live connection.
 */
@Component
public class StorageBackendHealthIndicator implements HealthIndicator {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final ConnectionManager connectionManager;

    public StorageBackendHealthIndicator(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public Health health() {
        try (ScopedConnection scoped = connectionManager.acquire()) {
            boolean valid = scoped.connection().isValid(VALIDATION_TIMEOUT_SECONDS);
            Health.Builder builder = valid ? Health.up() : Health.down();
            return builder
                    .withDetail("backend", scoped.backend().name())
                    .withDetail("fallback", connectionManager.isFallbackActive())
                    .build();
        } catch (BackendUnavailableException | SQLException ex) {
            return Health.down(ex)
                    .withDetail("configuredBackend", connectionManager.configuredBackend().name())
                    .build();
        }
    }
}
