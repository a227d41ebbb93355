package com.shopnest.authservice.controller;

import com.shopnest.authservice.SecurityConfig.AuthenticatedUser;
import com.shopnest.authservice.dto.ApiResponse;
import com.shopnest.authservice.dto.UpdateStatusRequest;
import com.shopnest.authservice.dto.UserPage;
import com.shopnest.authservice.dto.UserResponse;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.exception.RequestExceptions;
import com.shopnest.authservice.service.UserService;
import com.shopnest.authservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/** Admin-only user management; the role check lives in the security chain. */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class AdminUserController {

    private final UserService userService;

    @GetMapping
    @ResponseMessage("Users retrieved successfully")
    public UserPage listUsers(@RequestParam(defaultValue = "1") int page,
                              @RequestParam(defaultValue = "10") int limit,
                              @RequestParam(required = false) String role,
                              @RequestParam(required = false) Boolean isActive) {
        return userService.listUsers(page, limit, parseRole(role), isActive);
    }

    @GetMapping("/{id}")
    @ResponseMessage("User retrieved successfully")
    public UserResponse getUser(@PathVariable UUID id) {
        return userService.getUser(id);
    }

    @PutMapping("/{id}/status")
    @ResponseMessage("User status updated successfully")
    public UserResponse updateStatus(@PathVariable UUID id, @Valid @RequestBody UpdateStatusRequest request) {
        return userService.updateStatus(id, request.getIsActive());
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> deleteUser(@AuthenticationPrincipal AuthenticatedUser principal,
                                        @PathVariable UUID id) {
        userService.deleteUser(principal.id(), id);
        return ApiResponse.ok("User deleted successfully", null);
    }

    private static UserRole parseRole(String role) {
        if (role == null || role.isBlank()) return null;
        try {
            return UserRole.fromValue(role);
        } catch (IllegalArgumentException e) {
            throw new RequestExceptions.InvalidParameter(
                    "role must be one of customer, admin, vendor");
        }
    }
}
