package com.shopnest.authservice.service;

import com.shopnest.authservice.dto.AuthResponse;
import com.shopnest.authservice.dto.LoginRequest;
import com.shopnest.authservice.dto.RegisterRequest;
import com.shopnest.authservice.dto.TokenPair;

import java.util.Optional;
import java.util.UUID;

public interface AuthService {

    AuthResponse register(RegisterRequest request);

    AuthResponse login(LoginRequest request);

    /** Single-use rotation: the presented refresh token stops working. */
    TokenPair refresh(String refreshToken);

    void logout(String accessToken, String refreshToken);

    /**
     * Starts a password reset when the address is registered. Callers must respond
     * identically either way.
     *
     * @return the reset token, empty for unknown addresses
     */
    Optional<String> forgotPassword(String email);

    void resetPassword(String token, String newPassword);

    void changePassword(UUID userId, String currentPassword, String newPassword);

    void verifyEmail(String token);
}
