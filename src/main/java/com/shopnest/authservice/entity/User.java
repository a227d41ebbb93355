package com.shopnest.authservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.io.Serial;
import java.io.Serializable;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Locale;

@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = User.EMAIL_UNIQUE_CONSTRAINT, columnNames = "email")
}, indexes = {
        @Index(name = "idx_users_reset_token", columnList = "password_reset_token"),
        @Index(name = "idx_users_verification_token", columnList = "email_verification_token")
})
@NoArgsConstructor
@AllArgsConstructor
@Setter
@Getter
@SuperBuilder
public class User extends BaseEntity implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final Duration PASSWORD_RESET_LIFETIME = Duration.ofHours(1);
    private static final SecureRandom RANDOM = new SecureRandom();

    public static final String EMAIL_UNIQUE_CONSTRAINT = "uk_users_email";

    @Column(nullable = false, length = 254)
    private String email;

    @Column(name = "password_hash", nullable = false)
    @JsonIgnore
    @ToString.Exclude
    private String passwordHash;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private UserRole role = UserRole.CUSTOMER;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Builder.Default
    @Column(name = "is_email_verified", nullable = false)
    private boolean emailVerified = false;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "email_verification_token", length = 64)
    private String emailVerificationToken;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "password_reset_token", length = 64)
    private String passwordResetToken;

    @JsonIgnore
    @Column(name = "password_reset_expires")
    private Instant passwordResetExpires;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    /** Lower-cases and trims an address so lookups and the unique constraint agree. */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public void setEmail(String email) {
        this.email = normalizeEmail(email);
    }

    /**
     * Stores a hash of {@code plaintext}. Does nothing when the current hash already
     * matches it, so saving an unchanged password never re-hashes.
     */
    public void applyPassword(String plaintext, PasswordEncoder encoder) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        if (passwordHash != null && encoder.matches(plaintext, passwordHash)) {
            return;
        }
        String hash = encoder.encode(plaintext);
        if (hash == null) {
            throw new IllegalStateException("Password encoder returned no hash");
        }
        this.passwordHash = hash;
    }

    public boolean verifyPassword(String candidate, PasswordEncoder encoder) {
        if (candidate == null || passwordHash == null) {
            return false;
        }
        return encoder.matches(candidate, passwordHash);
    }

    /** Issues a single-use reset token valid for one hour. The caller persists the user. */
    public String generatePasswordResetToken(Clock clock) {
        String token = randomToken();
        this.passwordResetToken = token;
        this.passwordResetExpires = clock.instant().plus(PASSWORD_RESET_LIFETIME);
        return token;
    }

    public boolean hasLivePasswordReset(String token, Instant now) {
        return passwordResetToken != null
                && passwordResetToken.equals(token)
                && passwordResetExpires != null
                && passwordResetExpires.isAfter(now);
    }

    public void clearPasswordReset() {
        this.passwordResetToken = null;
        this.passwordResetExpires = null;
    }

    public String issueEmailVerificationToken() {
        this.emailVerificationToken = randomToken();
        return emailVerificationToken;
    }

    public void markEmailVerified() {
        this.emailVerified = true;
        this.emailVerificationToken = null;
    }

    public void recordLogin(Clock clock) {
        this.lastLogin = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    public void deactivate() {
        this.active = false;
    }

    /** Blank or missing values leave the current name untouched. */
    public void updateName(String first, String last) {
        if (first != null && !first.isBlank()) {
            this.firstName = first.trim();
        }
        if (last != null && !last.isBlank()) {
            this.lastName = last.trim();
        }
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    private static String randomToken() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
