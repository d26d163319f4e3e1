package com.hal9001.backend.modules.auth.application;

/**
 * A stored credential hash is not in a format the hasher can verify against. This is an
 * integrity fault in the user store, never a wrong-password outcome.
 */
public class MalformedHashException extends RuntimeException {

    public MalformedHashException(String message) {
        super(message);
    }
}
