package com.shopnest.authservice.SecurityConfig;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    private static final String PREFIX = "bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from a {@code "Bearer <token>"} header value; the scheme is
     * matched case-insensitively.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token string, or empty if the header is missing/malformed
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= PREFIX.length()
                || !trimmed.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        if (token.isEmpty() || token.contains(" ")) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
