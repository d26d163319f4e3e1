package com.hal9001.backend.global.datasource;

import java.util.Locale;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * A concrete storage engine the {@link ConnectionManager} can open a pool against.
 * Chosen once from {@link StorageSettings}; callers never branch on the backend again.
 */
public interface StorageBackend {

    BackendKind kind();

    String jdbcUrl();

    String driverClassName();

    default String username() {
        return null;
    }

    default String password() {
        return null;
    }

    /**
     * Human readable label for logs. Query parameters are cut off since drivers accept
     * credentials there.
     */
    default String describe() {
        String url = jdbcUrl();
        int query = url.indexOf('?');
        String safeUrl = query >= 0 ? url.substring(0, query) : url;
        return kind().name().toLowerCase(Locale.ROOT) + " (" + safeUrl + ")";
    }

    /**
     * Builds a pool and proves it can hand out one connection. Throws a
     * {@link RuntimeException} when the backend cannot be reached.
     */
    default HikariDataSource openPool(StorageSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("hal9001-" + kind().name().toLowerCase(Locale.ROOT));
        config.setDriverClassName(driverClassName());
        config.setJdbcUrl(jdbcUrl());
        if (username() != null) {
            config.setUsername(username());
        }
        if (password() != null) {
            config.setPassword(password());
        }
        config.setMinimumIdle(settings.poolMinIdle());
        config.setMaximumPoolSize(settings.poolMaxSize());
        config.setConnectionTimeout(settings.connectionTimeout().toMillis());
        // one connection check per construction attempt, retries are driven by ConnectionManager
        config.setInitializationFailTimeout(1);
        return new HikariDataSource(config);
    }

    static StorageBackend resolve(StorageSettings settings) {
        if (!settings.hasConfiguredUrl()) {
            return new EmbeddedStorageBackend(settings.embeddedUrl());
        }
        String url = settings.url().trim();
        if (url.startsWith(EmbeddedStorageBackend.URL_PREFIX)) {
            return new EmbeddedStorageBackend(url);
        }
        return NetworkedStorageBackend.fromDescriptor(url, settings.username(), settings.password());
    }
}
