package com.shopnest.authservice.SecurityConfig;

import com.shopnest.authservice.entity.UserRole;

import java.time.Instant;

/** Verified contents of an access token. */
public record AccessClaims(String userId, String email, UserRole role, String tokenId, Instant expiresAt) {
}
