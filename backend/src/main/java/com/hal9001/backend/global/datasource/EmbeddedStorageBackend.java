package com.hal9001.backend.global.datasource;

/**
 * In-process H2 database running in PostgreSQL compatibility mode.
 */
public class EmbeddedStorageBackend implements StorageBackend {

    public static final String URL_PREFIX = "jdbc:h2:";

    private static final String DRIVER = "org.h2.Driver";

    private final String jdbcUrl;

    public EmbeddedStorageBackend(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Embedded backend requires a " + URL_PREFIX + " url");
        }
        this.jdbcUrl = jdbcUrl;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.EMBEDDED;
    }

    @Override
    public String jdbcUrl() {
        return jdbcUrl;
    }

    @Override
    public String driverClassName() {
        return DRIVER;
    }

    @Override
    public String username() {
        return "sa";
    }

    @Override
    public String password() {
        return "";
    }
}
