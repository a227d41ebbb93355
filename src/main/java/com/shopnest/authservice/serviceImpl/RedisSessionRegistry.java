package com.shopnest.authservice.serviceImpl;

import com.shopnest.authservice.SecurityConfig.JwtTokenProvider;
import com.shopnest.authservice.dto.TokenPair;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.exception.ExternalExceptions;
import com.shopnest.authservice.service.SessionRegistry;
import com.shopnest.authservice.utils.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed session registry. Keys hold a SHA-256 of the token, never the token:
 * <ul>
 *   <li>{@code auth:refresh:<hash>} → user id, expires with the refresh token</li>
 *   <li>{@code auth:blacklist:<hash>} → "1", expires once the access token can no longer verify</li>
 * </ul>
 * A Redis failure is never treated as "not blacklisted" or "not found".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisSessionRegistry implements SessionRegistry {

    static final String REFRESH_PREFIX = "auth:refresh:";
    static final String BLACKLIST_PREFIX = "auth:blacklist:";

    private final StringRedisTemplate redis;
    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    @Override
    public TokenPair issuePair(@NonNull User user) {
        String accessToken = tokenProvider.issueAccess(user);
        String refreshToken = tokenProvider.issueRefresh(user);
        String userId = user.getId().toString();
        redisCall("store refresh token", () -> {
            redis.opsForValue().set(refreshKey(refreshToken), userId, tokenProvider.getRefreshTtl());
            return null;
        });
        return new TokenPair(accessToken, refreshToken);
    }

    @Override
    public Optional<String> validateRefresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return Optional.empty();
        return Optional.ofNullable(redisCall("read refresh token",
                () -> redis.opsForValue().get(refreshKey(refreshToken))));
    }

    @Override
    public boolean invalidateRefresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) return false;
        Boolean deleted = redisCall("delete refresh token", () -> redis.delete(refreshKey(refreshToken)));
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public void blacklist(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) return;

        Optional<Instant> expiry = tokenProvider.readExpiryUnverified(accessToken);
        if (expiry.isEmpty()) {
            log.debug("Blacklist skip: token expiry unreadable");
            return;
        }
        // the entry must outlive the verifier's skew window, rounded up to whole seconds
        Instant rejectedFrom = expiry.get().plus(tokenProvider.getClockSkew());
        long ttlMillis = Duration.between(clock.instant(), rejectedFrom).toMillis();
        if (ttlMillis <= 0) {
            // verification rejects it anyway
            return;
        }
        long ttlSeconds = (ttlMillis + 999) / 1000;
        redisCall("blacklist access token", () -> {
            redis.opsForValue().set(blacklistKey(accessToken), "1", Duration.ofSeconds(ttlSeconds));
            return null;
        });
    }

    @Override
    public boolean isBlacklisted(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) return false;
        Boolean present = redisCall("check blacklist", () -> redis.hasKey(blacklistKey(accessToken)));
        return Boolean.TRUE.equals(present);
    }

    // ---------- helpers ----------

    static String refreshKey(String token) {
        return REFRESH_PREFIX + SecureTokens.sha256Url(token);
    }

    static String blacklistKey(String token) {
        return BLACKLIST_PREFIX + SecureTokens.sha256Url(token);
    }

    private <T> T redisCall(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException dae) {
            log.error("Redis unavailable during '{}': {}", operation, dae.getMessage());
            throw new ExternalExceptions.UpstreamUnavailable("Session store unavailable", dae);
        }
    }
}
