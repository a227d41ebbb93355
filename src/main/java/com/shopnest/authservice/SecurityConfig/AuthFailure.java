package com.shopnest.authservice.SecurityConfig;

/**
 * Why a request carries no authentication. Recorded by {@link JwtAuthFilter} as a
 * request attribute and rendered by {@link JwtAuthenticationEntryPoint} only when the
 * route actually needs an identity.
 */
public enum AuthFailure {
    NO_TOKEN("No token provided"),
    TOKEN_REVOKED("Token has been revoked"),
    INVALID_TOKEN("Invalid or expired token"),
    AUTH_REQUIRED("Authentication required");

    public static final String REQUEST_ATTRIBUTE = AuthFailure.class.getName();

    private final String message;

    AuthFailure(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
