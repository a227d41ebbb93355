package com.shopnest.authservice.service;

import com.shopnest.authservice.dto.UserPage;
import com.shopnest.authservice.dto.UserResponse;
import com.shopnest.authservice.entity.UserRole;

import java.util.UUID;

public interface UserService {

    UserResponse getProfile(UUID userId);

    UserResponse updateProfile(UUID userId, String firstName, String lastName);

    /** Soft delete: the account stays but can no longer log in or refresh. */
    void deactivateOwnAccount(UUID userId);

    /**
     * Admin listing, newest first.
     *
     * @param page  1-based page number
     * @param limit page size, 1..100
     * @param role  optional filter
     * @param isActive optional filter
     */
    UserPage listUsers(int page, int limit, UserRole role, Boolean isActive);

    UserResponse getUser(UUID id);

    UserResponse updateStatus(UUID id, boolean isActive);

    /** Hard delete; an admin cannot delete their own account. */
    void deleteUser(UUID actorId, UUID id);
}
