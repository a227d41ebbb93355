package com.shopnest.authservice.SecurityConfig;

/** A token failed signature, issuer, audience, expiry or type checks. */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
