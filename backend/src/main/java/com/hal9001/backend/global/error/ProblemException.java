package com.hal9001.backend.global.error;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Application error carrying a stable machine-readable code. The code doubles as the
 * problem type suffix in the response body, see {@link ProblemResponse#of}.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;
    private final HttpHeaders headers;

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null, null);
    }

    protected ProblemException(HttpStatus status, String code, String detail, HttpHeaders headers, Throwable cause) {
        super(status, code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        this.headers = headers != null ? HttpHeaders.readOnlyHttpHeaders(headers) : HttpHeaders.EMPTY;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    @Override
    public HttpHeaders getHeaders() {
        return headers;
    }
}
