package com.hal9001.backend.global.datasource;

/**
 * No storage backend could produce a pool or a connection. Mapped to 503 at the boundary.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
