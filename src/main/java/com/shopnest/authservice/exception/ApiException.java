package com.shopnest.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying the HTTP status and machine-readable code of the error envelope.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;   // e.g. INVALID_CREDENTIALS

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    protected ApiException(HttpStatus status, String code, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
    }
}
