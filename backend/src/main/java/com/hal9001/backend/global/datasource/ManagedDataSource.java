package com.hal9001.backend.global.datasource;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.logging.Logger;

import javax.sql.DataSource;

/**
 * Data source facade that resolves the backend through {@link ConnectionManager} on the
 * first {@code getConnection} call and delegates everything to the selected pool.
 */
class ManagedDataSource implements DataSource {

    private final ConnectionManager manager;

    ManagedDataSource(ConnectionManager manager) {
        this.manager = manager;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return manager.borrow();
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        // the pool is bound to the configured credentials
        throw new SQLFeatureNotSupportedException("Per-call credentials are not supported by the managed pool");
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        return manager.pool().unwrap(iface);
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        return iface.isInstance(this) || manager.pool().isWrapperFor(iface);
    }

    @Override
    public PrintWriter getLogWriter() throws SQLException {
        return manager.pool().getLogWriter();
    }

    @Override
    public void setLogWriter(PrintWriter out) throws SQLException {
        manager.pool().setLogWriter(out);
    }

    @Override
    public void setLoginTimeout(int seconds) throws SQLException {
        manager.pool().setLoginTimeout(seconds);
    }

    @Override
    public int getLoginTimeout() throws SQLException {
        return manager.pool().getLoginTimeout();
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        return manager.pool().getParentLogger();
    }
}
