package com.hal9001.backend.modules.auth.application;

import com.hal9001.backend.global.error.ProblemException;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

public class UnauthenticatedException extends ProblemException {

    public static final String BEARER_CHALLENGE = "Bearer";

    public UnauthenticatedException() {
        this(null);
    }

    public UnauthenticatedException(Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, "unauthenticated", "Could not validate credentials", bearerChallenge(), cause);
    }

    static HttpHeaders bearerChallenge() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE);
        return headers;
    }
}
