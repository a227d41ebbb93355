package com.shopnest.authservice.SecurityConfig;

import com.shopnest.authservice.entity.UserRole;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.UUID;

/**
 * Principal placed in the security context for a verified access token.
 * Built from the token's claims alone; the user store is not consulted.
 */
public record AuthenticatedUser(String userId, String email, UserRole role) {

    public static AuthenticatedUser from(AccessClaims claims) {
        return new AuthenticatedUser(claims.userId(), claims.email(), claims.role());
    }

    public UUID id() {
        return UUID.fromString(userId);
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public List<SimpleGrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }
}
