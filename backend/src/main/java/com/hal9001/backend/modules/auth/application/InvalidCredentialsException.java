package com.hal9001.backend.modules.auth.application;

import com.hal9001.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Raised for an unknown email and for a wrong secret alike.
 */
public class InvalidCredentialsException extends ProblemException {

    public InvalidCredentialsException() {
        super(HttpStatus.UNAUTHORIZED, "invalid_credentials", "Incorrect username or password",
                UnauthenticatedException.bearerChallenge(), null);
    }
}
