package com.shopnest.authservice.service;

import com.shopnest.authservice.dto.TokenPair;
import com.shopnest.authservice.entity.User;

import java.util.Optional;

/**
 * Server-side session state: the live refresh-token entries and the access-token
 * blacklist. Every method surfaces a cache outage as
 * {@link com.shopnest.authservice.exception.ExternalExceptions.UpstreamUnavailable}.
 */
public interface SessionRegistry {

    /** Mints an access/refresh pair and records the refresh token as live. */
    TokenPair issuePair(User user);

    /** User id stored for a live refresh token, empty when unknown or expired. */
    Optional<String> validateRefresh(String refreshToken);

    /**
     * Removes a refresh entry.
     *
     * @return true only for the caller that actually deleted it
     */
    boolean invalidateRefresh(String refreshToken);

    /** Revokes an access token for the rest of its lifetime. */
    void blacklist(String accessToken);

    boolean isBlacklisted(String accessToken);
}
