package com.shopnest.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming client request itself (missing or invalid input).
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – A required parameter is missing/blank/invalid. */
    public static final class InvalidParameter extends ApiException {
        public InvalidParameter(String message) {
            super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
        }
    }
}
