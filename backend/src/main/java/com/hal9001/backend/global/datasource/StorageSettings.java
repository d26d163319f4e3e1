package com.hal9001.backend.global.datasource;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings read once at startup. {@code url} may be blank, in which case the
 * embedded backend is used.
 */
public record StorageSettings(
        String url,
        String username,
        String password,
        String embeddedUrl,
        int poolMinIdle,
        int poolMaxSize,
        Duration connectionTimeout,
        int constructionAttempts,
        Duration constructionBackoff
) {

    public static final String DEFAULT_EMBEDDED_URL =
            "jdbc:h2:mem:hal9001;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";

    public StorageSettings {
        if (embeddedUrl == null || embeddedUrl.isBlank()) {
            embeddedUrl = DEFAULT_EMBEDDED_URL;
        }
        if (poolMinIdle < 0) {
            throw new IllegalArgumentException("pool min idle must be >= 0");
        }
        if (poolMaxSize < 1) {
            throw new IllegalArgumentException("pool max size must be >= 1");
        }
        if (poolMinIdle > poolMaxSize) {
            throw new IllegalArgumentException("pool min idle (" + poolMinIdle + ") exceeds max size (" + poolMaxSize + ")");
        }
        Objects.requireNonNull(connectionTimeout, "connectionTimeout");
        Objects.requireNonNull(constructionBackoff, "constructionBackoff");
        if (constructionAttempts < 1) {
            throw new IllegalArgumentException("construction attempts must be >= 1");
        }
    }

    public static StorageSettings embeddedDefaults() {
        return new StorageSettings(null, null, null, DEFAULT_EMBEDDED_URL, 1, 10,
                Duration.ofSeconds(30), 1, Duration.ZERO);
    }

    public boolean hasConfiguredUrl() {
        return url != null && !url.isBlank();
    }

    public StorageSettings withUrl(String newUrl) {
        return new StorageSettings(newUrl, username, password, embeddedUrl, poolMinIdle, poolMaxSize,
                connectionTimeout, constructionAttempts, constructionBackoff);
    }

    public StorageSettings withEmbeddedUrl(String newEmbeddedUrl) {
        return new StorageSettings(url, username, password, newEmbeddedUrl, poolMinIdle, poolMaxSize,
                connectionTimeout, constructionAttempts, constructionBackoff);
    }

    public StorageSettings withConstruction(int attempts, Duration backoff) {
        return new StorageSettings(url, username, password, embeddedUrl, poolMinIdle, poolMaxSize,
                connectionTimeout, attempts, backoff);
    }

    @Override
    public String toString() {
        // password is left out so the settings can be logged
        return "StorageSettings[url=" + url + ", username=" + username + ", embeddedUrl=" + embeddedUrl
                + ", poolMinIdle=" + poolMinIdle + ", poolMaxSize=" + poolMaxSize
                + ", connectionTimeout=" + connectionTimeout + ", constructionAttempts=" + constructionAttempts
                + ", constructionBackoff=" + constructionBackoff + "]";
    }
}
