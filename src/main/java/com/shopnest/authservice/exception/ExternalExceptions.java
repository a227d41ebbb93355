package com.shopnest.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Failures caused by infrastructure this service depends on (Redis, database).
 * Wrap the low-level exception so the cause is kept for logging.
 */
public final class ExternalExceptions {

    private ExternalExceptions() {}

    /** 503 Service Unavailable – Session cache or another backing store cannot be reached. */
    public static final class UpstreamUnavailable extends ApiException {
        public UpstreamUnavailable(String message, Throwable cause) {
            super(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", message, cause);
        }
    }
}
