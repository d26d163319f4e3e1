package com.hal9001.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String DEFAULT_TYPE_PREFIX = "https://hal9001.app/errors/";

    public static ProblemResponse of(HttpStatusCode statusCode, String code, String detail, String instance) {
        HttpStatus httpStatus = HttpStatus.resolve(statusCode.value());
        String reason = httpStatus != null ? httpStatus.getReasonPhrase() : String.valueOf(statusCode.value());
        String fallbackCode = httpStatus != null ? httpStatus.name().toLowerCase() : "error";
        String safeCode = (code != null && !code.isBlank()) ? code : fallbackCode;
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : reason;
        return new ProblemResponse(DEFAULT_TYPE_PREFIX + normalized, reason, statusCode.value(), safeDetail, instance, safeCode);
    }
}
