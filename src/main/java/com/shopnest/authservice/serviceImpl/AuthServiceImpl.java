package com.shopnest.authservice.serviceImpl;

import com.shopnest.authservice.SecurityConfig.InvalidTokenException;
import com.shopnest.authservice.SecurityConfig.JwtTokenProvider;
import com.shopnest.authservice.dto.AuthResponse;
import com.shopnest.authservice.dto.LoginRequest;
import com.shopnest.authservice.dto.RegisterRequest;
import com.shopnest.authservice.dto.TokenPair;
import com.shopnest.authservice.dto.UserResponse;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.exception.AuthExceptions;
import com.shopnest.authservice.exception.UserExceptions;
import com.shopnest.authservice.repository.UserRepository;
import com.shopnest.authservice.service.AuthService;
import com.shopnest.authservice.service.EmailService;
import com.shopnest.authservice.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final SessionRegistry sessionRegistry;
    private final EmailService emailService;
    private final Clock clock;

    @Override
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        final String email = User.normalizeEmail(Objects.requireNonNull(request.getEmail(), "email is required"));

        if (userRepository.existsByEmail(email)) {
            throw new UserExceptions.EmailAlreadyExists();
        }
        UserRole role = request.getRole() == null ? UserRole.CUSTOMER : request.getRole();
        if (role == UserRole.ADMIN) {
            throw new UserExceptions.RoleNotAllowed(role.value());
        }

        User user = User.builder()
                .email(email)
                .firstName(request.getFirstName().trim())
                .lastName(request.getLastName().trim())
                .role(role)
                .build();
        user.applyPassword(request.getPassword(), passwordEncoder);
        String verificationToken = user.issueEmailVerificationToken();

        User saved = userRepository.save(user);
        emailService.sendVerificationEmail(saved.getEmail(), verificationToken);

        TokenPair tokens = sessionRegistry.issuePair(saved);
        log.info("Registered user id={} role={}", saved.getId(), role.value());
        return new AuthResponse(UserResponse.from(saved), tokens);
    }

    @Override
    @Transactional
    public AuthResponse login(LoginRequest request) {
        final String email = User.normalizeEmail(request.getEmail());

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> {
                    log.info("Login failed: unknown email");
                    return new AuthExceptions.InvalidCredentials();
                });

        if (!user.verifyPassword(request.getPassword(), passwordEncoder)) {
            log.info("Login failed: bad password for user id={}", user.getId());
            throw new AuthExceptions.InvalidCredentials();
        }

        // only revealed to a caller who already proved the password
        if (!user.isActive()) {
            log.info("Login refused: user id={} is deactivated", user.getId());
            throw new AuthExceptions.AccountDeactivated();
        }

        user.recordLogin(clock);
        User saved = userRepository.save(user);

        TokenPair tokens = sessionRegistry.issuePair(saved);
        log.info("Login success for user id={}", saved.getId());
        return new AuthResponse(UserResponse.from(saved), tokens);
    }

    @Override
    @Transactional(readOnly = true)
    public TokenPair refresh(String refreshToken) {
        final String userId;
        try {
            userId = tokenProvider.verifyRefresh(refreshToken);
        } catch (InvalidTokenException e) {
            throw new AuthExceptions.InvalidRefreshToken();
        }

        String storedUserId = sessionRegistry.validateRefresh(refreshToken)
                .orElseThrow(AuthExceptions.InvalidRefreshToken::new);
        if (!storedUserId.equals(userId)) {
            log.warn("Refresh token subject mismatch for user id={}", userId);
            throw new AuthExceptions.InvalidRefreshToken();
        }

        User user = findUser(userId)
                .filter(User::isActive)
                .orElseThrow(UserExceptions.UserNotFound::new);

        // the caller that deletes the entry wins; a concurrent replay gets nothing
        if (!sessionRegistry.invalidateRefresh(refreshToken)) {
            log.warn("Refresh token for user id={} was already used", userId);
            throw new AuthExceptions.InvalidRefreshToken();
        }

        log.debug("Rotated refresh token for user id={}", userId);
        return sessionRegistry.issuePair(user);
    }

    @Override
    public void logout(String accessToken, String refreshToken) {
        sessionRegistry.blacklist(accessToken);
        if (refreshToken != null && !refreshToken.isBlank()) {
            sessionRegistry.invalidateRefresh(refreshToken);
        }
        log.info("Logout completed");
    }

    @Override
    @Transactional
    public Optional<String> forgotPassword(String email) {
        Optional<User> found = userRepository.findByEmail(User.normalizeEmail(email));
        if (found.isEmpty()) {
            log.info("Password reset requested for unknown email");
            return Optional.empty();
        }
        User user = found.get();
        String token = user.generatePasswordResetToken(clock);
        userRepository.save(user);
        emailService.sendPasswordResetEmail(user.getEmail(), token);
        log.info("Password reset issued for user id={}", user.getId());
        return Optional.of(token);
    }

    @Override
    @Transactional
    public void resetPassword(String token, String newPassword) {
        User user = userRepository.findByPasswordResetToken(token)
                .filter(u -> u.hasLivePasswordReset(token, clock.instant()))
                .orElseThrow(() -> new AuthExceptions.InvalidToken("Invalid or expired reset token"));

        user.applyPassword(newPassword, passwordEncoder);
        user.clearPasswordReset();
        userRepository.save(user);
        log.info("Password reset completed for user id={}", user.getId());
    }

    @Override
    @Transactional
    public void changePassword(UUID userId, String currentPassword, String newPassword) {
        User user = userRepository.findById(userId)
                .orElseThrow(UserExceptions.UserNotFound::new);

        if (!user.verifyPassword(currentPassword, passwordEncoder)) {
            throw new AuthExceptions.InvalidPassword();
        }
        user.applyPassword(newPassword, passwordEncoder);
        userRepository.save(user);
        log.info("Password changed for user id={}", userId);
    }

    @Override
    @Transactional
    public void verifyEmail(String token) {
        User user = userRepository.findByEmailVerificationToken(token)
                .orElseThrow(() -> new AuthExceptions.InvalidToken("Invalid verification token"));
        user.markEmailVerified();
        userRepository.save(user);
        log.info("Email verified for user id={}", user.getId());
    }

    // -------------------- helpers --------------------

    private Optional<User> findUser(String userId) {
        try {
            return userRepository.findById(UUID.fromString(userId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
