package com.shopnest.authservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;

import java.time.LocalDateTime;
import java.util.UUID;

/** Public view of a user. Never carries the password hash or one-time tokens. */
public record UserResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        UserRole role,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("isEmailVerified") boolean isEmailVerified,
        LocalDateTime lastLogin,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.isActive(),
                user.isEmailVerified(),
                user.getLastLogin(),
                user.getCreatedAt(),
                user.getUpdatedAt());
    }
}
