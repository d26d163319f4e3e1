package com.hal9001.backend.global.error;

import java.sql.SQLTransientConnectionException;

import com.hal9001.backend.global.datasource.BackendUnavailableException;
import com.hal9001.backend.modules.auth.application.MalformedHashException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    static final String VALIDATION_ERROR = "validation_error";

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode status = ex.getStatusCode();
        ProblemResponse body;
        if (ex instanceof ProblemException problem) {
            body = ProblemResponse.of(status, problem.getCode(), problem.getDetailMessage(), request.getRequestURI());
        } else {
            String message = ex.getReason();
            body = ProblemResponse.of(status, message, message, request.getRequestURI());
        }
        return ResponseEntity.status(status).headers(ex.getHeaders()).body(body);
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(BindException ex, HttpServletRequest request) {
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        return problem(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, detail, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        Throwable cause = ex.getMostSpecificCause();
        String detail = cause != null && cause != ex ? firstLine(cause.getMessage()) : "Malformed request body";
        return problem(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, detail, request);
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ProblemResponse> handleBackendUnavailable(BackendUnavailableException ex, HttpServletRequest request) {
        log.error("Storage backend unavailable while serving {}", request.getRequestURI(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable", "Storage backend is unavailable", request);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleConstraintViolation(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Constraint violation while serving {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "conflict", "The request conflicts with existing data", request);
    }

    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ProblemResponse> handleStorageFailure(RuntimeException ex, HttpServletRequest request) {
        if (isConnectionFailure(ex)) {
            log.error("Storage backend unavailable while serving {}", request.getRequestURI(), ex);
            return problem(HttpStatus.SERVICE_UNAVAILABLE, "backend_unavailable", "Storage backend is unavailable", request);
        }
        log.error("Storage operation failed while serving {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", "Storage operation failed", request);
    }

    @ExceptionHandler(MalformedHashException.class)
    public ResponseEntity<ProblemResponse> handleMalformedHash(MalformedHashException ex, HttpServletRequest request) {
        log.error("Credential integrity fault while serving {}: {}", request.getRequestURI(), ex.getMessage());
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "credential_integrity_error", "Stored credential is unusable", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            String detail = errorResponse.getBody().getDetail();
            ProblemResponse body = ProblemResponse.of(status, null, detail, request.getRequestURI());
            return ResponseEntity.status(status).headers(errorResponse.getHeaders()).body(body);
        }
        log.error("Unhandled error while serving {}", request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error", request);
    }

    private ResponseEntity<ProblemResponse> problem(HttpStatus status, String code, String detail, HttpServletRequest request) {
        ProblemResponse body = ProblemResponse.of(status, code, detail, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private static boolean isConnectionFailure(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof BackendUnavailableException || current instanceof SQLTransientConnectionException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "Malformed request body";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
