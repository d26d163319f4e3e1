package com.hal9001.backend.global.datasource;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Owns the process-wide connection pool.
 *
 * <p>The backend is chosen lazily on first use: the configured backend is opened with up
 * to {@code constructionAttempts} tries, and if that never succeeds the embedded backend
 * takes over for the rest of the process lifetime. After selection the choice never
 * changes; only the pool's own counters move.
 *
 * <p>Every Spring component reaches storage through {@link #dataSource()}, so JPA, Flyway
 * and transactions share the selected pool. Code that needs a raw connection uses
 * {@link #acquire()}.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final StorageSettings settings;
    private final StorageBackend configuredBackend;
    private final StorageBackend fallbackBackend;
    private final ManagedDataSource dataSource;

    private final Object selectionLock = new Object();
    private volatile ActivePool active;
    private volatile boolean closed;

    public ConnectionManager(StorageSettings settings) {
        this(settings, resolveConfigured(settings), new EmbeddedStorageBackend(settings.embeddedUrl()));
    }

    ConnectionManager(StorageSettings settings, StorageBackend configuredBackend, StorageBackend fallbackBackend) {
        this.settings = settings;
        this.configuredBackend = configuredBackend;
        this.fallbackBackend = fallbackBackend;
        this.dataSource = new ManagedDataSource(this);
    }

    /**
     * A descriptor that can never name a backend is a configuration error and fails startup;
     * only backends that cannot be reached take the fallback path.
     */
    private static StorageBackend resolveConfigured(StorageSettings settings) {
        try {
            return StorageBackend.resolve(settings);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid hal.storage.url: " + ex.getMessage(), ex);
        }
    }

    /**
     * Borrows a connection from the selected pool, blocking until one is free or the
     * pool's connection timeout expires.
     *
     * @throws BackendUnavailableException when no backend can be opened or the pool
     *                                     cannot produce a connection in time
     */
    public ScopedConnection acquire() {
        ActivePool pool = ensureSelected();
        try {
            return new ScopedConnection(pool.dataSource().getConnection(), pool.kind());
        } catch (SQLException ex) {
            throw new BackendUnavailableException(
                    "Could not obtain a connection from the " + pool.kind() + " backend", ex);
        }
    }

    /**
     * A {@link DataSource} view over the selected pool, suitable for registration as the
     * application's data source.
     */
    public DataSource dataSource() {
        return dataSource;
    }

    public BackendKind activeBackend() {
        return ensureSelected().kind();
    }

    public boolean isFallbackActive() {
        return ensureSelected().fallback();
    }

    public BackendKind configuredBackend() {
        return configuredBackend.kind();
    }

    Connection borrow() throws SQLException {
        return ensureSelected().dataSource().getConnection();
    }

    HikariDataSource pool() {
        return ensureSelected().dataSource();
    }

    private ActivePool ensureSelected() {
        ActivePool current = active;
        if (current != null) {
            return current;
        }
        synchronized (selectionLock) {
            if (closed) {
                throw new BackendUnavailableException("Connection manager is closed", null);
            }
            if (active == null) {
                active = select();
            }
            return active;
        }
    }

    private ActivePool select() {
        try {
            HikariDataSource pool = open(configuredBackend);
            log.info("Storage backend selected: {}", configuredBackend.describe());
            return new ActivePool(configuredBackend.kind(), pool, false);
        } catch (BackendUnavailableException ex) {
            if (configuredBackend.kind() == BackendKind.EMBEDDED) {
                throw ex;
            }
            log.warn("Backend {} could not be opened, falling back to {} for the rest of this process",
                    configuredBackend.describe(), fallbackBackend.describe(), ex);
        }
        HikariDataSource pool = open(fallbackBackend);
        log.info("Storage backend selected: {} (fallback)", fallbackBackend.describe());
        return new ActivePool(fallbackBackend.kind(), pool, true);
    }

    private HikariDataSource open(StorageBackend backend) {
        int attempts = settings.constructionAttempts();
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return backend.openPool(settings);
            } catch (RuntimeException ex) {
                lastFailure = ex;
                log.warn("Attempt {}/{} to open {} failed: {}", attempt, attempts, backend.describe(), ex.getMessage());
                if (attempt < attempts) {
                    pause(settings.constructionBackoff(), backend);
                }
            }
        }
        throw new BackendUnavailableException("Could not open " + backend.describe()
                + " after " + attempts + " attempt(s)", lastFailure);
    }

    private void pause(Duration backoff, StorageBackend backend) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while opening " + backend.describe(), ex);
        }
    }

    @Override
    public void close() {
        synchronized (selectionLock) {
            closed = true;
            ActivePool current = active;
            active = null;
            if (current != null) {
                log.info("Closing {} connection pool", current.kind());
                current.dataSource().close();
            }
        }
    }

    private record ActivePool(BackendKind kind, HikariDataSource dataSource, boolean fallback) {
    }
}
