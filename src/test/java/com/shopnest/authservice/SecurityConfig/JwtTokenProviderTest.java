package com.shopnest.authservice.SecurityConfig;

import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import com.shopnest.authservice.support.MutableClock;
import com.shopnest.authservice.support.TestUsers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.shopnest.authservice.support.TestUsers.ACCESS_SECRET;
import static com.shopnest.authservice.support.TestUsers.REFRESH_SECRET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenProviderTest {

    private MutableClock clock;
    private JwtTokenProvider provider;
    private User user;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T10:00:00Z");
        provider = TestUsers.tokenProvider(clock);
        user = TestUsers.user("alice@example.com", UserRole.VENDOR);
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("carry the user's id, email and role")
        void roundTripsIdentity() {
            AccessClaims claims = provider.verifyAccess(provider.issueAccess(user));

            assertThat(claims.userId()).isEqualTo(user.getId().toString());
            assertThat(claims.email()).isEqualTo("alice@example.com");
            assertThat(claims.role()).isEqualTo(UserRole.VENDOR);
            assertThat(claims.expiresAt()).isEqualTo(Instant.parse("2025-01-01T10:15:00Z"));
        }

        @Test
        @DisplayName("two tokens minted in the same instant differ")
        void tokensAreUnique() {
            assertThat(provider.issueAccess(user)).isNotEqualTo(provider.issueAccess(user));
        }

        @Test
        @DisplayName("are rejected once expired beyond the clock skew")
        void expiredTokenRejected() {
            String token = provider.issueAccess(user);
            clock.advance(Duration.ofMinutes(15).plusSeconds(31));

            assertThatThrownBy(() -> provider.verifyAccess(token)).isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("are still accepted within the clock skew")
        void skewTolerated() {
            String token = provider.issueAccess(user);
            clock.advance(Duration.ofMinutes(15).plusSeconds(10));

            assertThat(provider.verifyAccess(token).email()).isEqualTo("alice@example.com");
        }

        @Test
        @DisplayName("report the skew they tolerate past expiry")
        void skewMatchesVerification() {
            String token = provider.issueAccess(user);
            clock.advance(Duration.ofMinutes(15).plus(provider.getClockSkew()));
            assertThat(provider.verifyAccess(token).email()).isEqualTo("alice@example.com");

            clock.advance(Duration.ofSeconds(1));
            assertThatThrownBy(() -> provider.verifyAccess(token)).isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("from another audience are rejected")
        void wrongAudienceRejected() {
            JwtTokenProvider other = new JwtTokenProvider(ACCESS_SECRET, REFRESH_SECRET,
                    Duration.ofMinutes(15), Duration.ofDays(7), TestUsers.ISSUER, "another-platform", clock);

            assertThatThrownBy(() -> provider.verifyAccess(other.issueAccess(user)))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("with a tampered payload are rejected")
        void tamperedRejected() {
            String[] parts = provider.issueAccess(user).split("\\.");
            String otherPayload = provider.issueAccess(TestUsers.user("mallory@example.com", UserRole.ADMIN))
                    .split("\\.")[1];
            String forged = parts[0] + "." + otherPayload + "." + parts[2];

            assertThatThrownBy(() -> provider.verifyAccess(forged)).isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("cannot be used as refresh tokens")
        void accessIsNotRefresh() {
            String access = provider.issueAccess(user);

            assertThatThrownBy(() -> provider.verifyRefresh(access)).isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    @DisplayName("refresh tokens")
    class RefreshTokens {

        @Test
        @DisplayName("resolve to the user id")
        void roundTripsUserId() {
            assertThat(provider.verifyRefresh(provider.issueRefresh(user))).isEqualTo(user.getId().toString());
        }

        @Test
        @DisplayName("cannot be used as access tokens")
        void refreshIsNotAccess() {
            String refresh = provider.issueRefresh(user);

            assertThatThrownBy(() -> provider.verifyAccess(refresh)).isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("expire after seven days")
        void expire() {
            String refresh = provider.issueRefresh(user);
            clock.advance(Duration.ofDays(7).plusMinutes(1));

            assertThatThrownBy(() -> provider.verifyRefresh(refresh)).isInstanceOf(InvalidTokenException.class);
        }
    }

    @Nested
    @DisplayName("unverified expiry")
    class UnverifiedExpiry {

        @Test
        void readsExp() {
            assertThat(provider.readExpiryUnverified(provider.issueAccess(user)))
                    .contains(Instant.parse("2025-01-01T10:15:00Z"));
        }

        @Test
        void garbageGivesEmpty() {
            assertThat(provider.readExpiryUnverified("not-a-jwt")).isEmpty();
            assertThat(provider.readExpiryUnverified("a.@@@.c")).isEmpty();
            assertThat(provider.readExpiryUnverified(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("configuration")
    class Configuration {

        @Test
        void identicalSecretsRefused() {
            assertThatThrownBy(() -> new JwtTokenProvider(ACCESS_SECRET, ACCESS_SECRET,
                    Duration.ofMinutes(15), Duration.ofDays(7), TestUsers.ISSUER, TestUsers.AUDIENCE, clock))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("must differ");
        }

        @Test
        void shortSecretRefused() {
            assertThatThrownBy(() -> new JwtTokenProvider("c2hvcnQ=", REFRESH_SECRET,
                    Duration.ofMinutes(15), Duration.ofDays(7), TestUsers.ISSUER, TestUsers.AUDIENCE, clock))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("too short");
        }

        @Test
        void missingSecretRefused() {
            assertThatThrownBy(() -> new JwtTokenProvider(" ", REFRESH_SECRET,
                    Duration.ofMinutes(15), Duration.ofDays(7), TestUsers.ISSUER, TestUsers.AUDIENCE, clock))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
