package com.shopnest.authservice.controller;

import com.shopnest.authservice.SecurityConfig.AuthenticatedUser;
import com.shopnest.authservice.dto.ApiResponse;
import com.shopnest.authservice.dto.UpdateProfileRequest;
import com.shopnest.authservice.dto.UserResponse;
import com.shopnest.authservice.service.UserService;
import com.shopnest.authservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/** The caller's own account. */
@RestController
@RequestMapping("/users/profile")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    @ResponseMessage("Profile retrieved successfully")
    public UserResponse getProfile(@AuthenticationPrincipal AuthenticatedUser principal) {
        return userService.getProfile(principal.id());
    }

    @PutMapping
    @ResponseMessage("Profile updated successfully")
    public UserResponse updateProfile(@AuthenticationPrincipal AuthenticatedUser principal,
                                      @Valid @RequestBody UpdateProfileRequest request) {
        return userService.updateProfile(principal.id(), request.getFirstName(), request.getLastName());
    }

    @DeleteMapping
    public ApiResponse<Void> deleteAccount(@AuthenticationPrincipal AuthenticatedUser principal) {
        userService.deactivateOwnAccount(principal.id());
        return ApiResponse.ok("Account deleted successfully", null);
    }
}
