package com.shopnest.authservice.controller;

import com.shopnest.authservice.SecurityConfig.AuthenticatedUser;
import com.shopnest.authservice.SecurityConfig.BearerTokenExtractor;
import com.shopnest.authservice.dto.*;
import com.shopnest.authservice.service.AuthService;
import com.shopnest.authservice.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/auth")
public class AuthController {

    static final String FORGOT_PASSWORD_MESSAGE = "If the email exists, a reset link has been sent";

    private final AuthService authService;
    private final boolean exposeResetToken;

    public AuthController(AuthService authService,
                          @Value("${app.auth.expose-reset-token:false}") boolean exposeResetToken) {
        this.authService = authService;
        this.exposeResetToken = exposeResetToken;
        if (exposeResetToken) {
            log.warn("Password reset tokens are returned in API responses; never enable this outside development");
        }
    }

    @PostMapping("/register")
    @ResponseMessage("Registration successful. Please verify your email.")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    @ResponseMessage("Login successful")
    public AuthResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request);
    }

    @PostMapping("/refresh")
    @ResponseMessage("Token refreshed successfully")
    public TokensResponse refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return new TokensResponse(authService.refresh(request.getRefreshToken()));
    }

    @PostMapping("/logout")
    public ApiResponse<Void> logout(@RequestHeader(HttpHeaders.AUTHORIZATION) String authorization,
                                    @AuthenticationPrincipal AuthenticatedUser principal,
                                    @RequestBody(required = false) LogoutRequest body) {
        // the guard already validated this header
        String accessToken = BearerTokenExtractor.extract(authorization).orElseThrow();
        authService.logout(accessToken, body == null ? null : body.getRefreshToken());
        log.info("User id={} logged out", principal.userId());
        return ApiResponse.ok("Logout successful", null);
    }

    @PostMapping("/forgot-password")
    public ApiResponse<ResetTokenResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        Optional<String> token = authService.forgotPassword(request.getEmail());
        ResetTokenResponse data = exposeResetToken ? token.map(ResetTokenResponse::new).orElse(null) : null;
        return ApiResponse.ok(FORGOT_PASSWORD_MESSAGE, data);
    }

    @PostMapping("/reset-password")
    public ApiResponse<Void> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(request.getToken(), request.getPassword());
        return ApiResponse.ok("Password reset successful", null);
    }

    @PostMapping("/change-password")
    public ApiResponse<Void> changePassword(@AuthenticationPrincipal AuthenticatedUser principal,
                                            @Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(principal.id(), request.getCurrentPassword(), request.getNewPassword());
        return ApiResponse.ok("Password changed successfully", null);
    }

    @GetMapping("/verify-email/{token}")
    public ApiResponse<Void> verifyEmail(@PathVariable String token) {
        authService.verifyEmail(token);
        return ApiResponse.ok("Email verified successfully", null);
    }
}
