package com.hal9001.backend.global.datasource;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A pooled connection bound to a try-with-resources block. Closing it hands the
 * connection back to the pool.
 */
public final class ScopedConnection implements AutoCloseable {

    private final Connection connection;
    private final BackendKind backend;

    ScopedConnection(Connection connection, BackendKind backend) {
        this.connection = connection;
        this.backend = backend;
    }

    public Connection connection() {
        return connection;
    }

    public BackendKind backend() {
        return backend;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }
}
