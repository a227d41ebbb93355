package com.shopnest.authservice.SecurityConfig;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopnest.authservice.entity.User;
import com.shopnest.authservice.entity.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies the two HS256 token kinds.
 * <ul>
 *   <li>access: {@code sub}, {@code email}, {@code role}, {@code iss}, {@code aud}; short-lived</li>
 *   <li>refresh: {@code sub}, {@code type=refresh}, {@code iss}; signed with a separate secret</li>
 * </ul>
 * Both carry a random {@code jti} so two tokens minted in the same second still differ.
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_TYPE = "type";
    static final String REFRESH_TYPE = "refresh";
    private static final long CLOCK_SKEW_SECONDS = 30;
    private static final ObjectMapper PAYLOAD_READER = new ObjectMapper();

    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final String issuer;
    private final String audience;
    private final Clock clock;

    /** Cached, thread-safe parsers */
    private final JwtParser accessParser;
    private final JwtParser refreshParser;

    public JwtTokenProvider(@Value("${token.access.secret}") String accessSecret,
                            @Value("${token.refresh.secret}") String refreshSecret,
                            @Value("${token.access.ttl:15m}") Duration accessTtl,
                            @Value("${token.refresh.ttl:7d}") Duration refreshTtl,
                            @Value("${token.issuer:ecommerce-auth}") String issuer,
                            @Value("${token.audience:ecommerce-platform}") String audience,
                            Clock clock) {
        byte[] accessBytes = decodeSecret("token.access.secret", accessSecret);
        byte[] refreshBytes = decodeSecret("token.refresh.secret", refreshSecret);
        if (Arrays.equals(accessBytes, refreshBytes)) {
            throw new IllegalStateException("Access and refresh token secrets must differ.");
        }
        if (accessTtl.isNegative() || accessTtl.isZero() || refreshTtl.isNegative() || refreshTtl.isZero()) {
            throw new IllegalStateException("Token lifetimes must be positive.");
        }
        this.accessKey = Keys.hmacShaKeyFor(accessBytes);
        this.refreshKey = Keys.hmacShaKeyFor(refreshBytes);
        this.accessTtl = accessTtl;
        this.refreshTtl = refreshTtl;
        this.issuer = issuer;
        this.audience = audience;
        this.clock = clock;

        io.jsonwebtoken.Clock jwtClock = () -> Date.from(clock.instant());
        this.accessParser = Jwts.parser()
                .verifyWith(accessKey)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clock(jwtClock)
                .clockSkewSeconds(CLOCK_SKEW_SECONDS) // tolerate small clock drift
                .build();
        this.refreshParser = Jwts.parser()
                .verifyWith(refreshKey)
                .requireIssuer(issuer)
                .clock(jwtClock)
                .clockSkewSeconds(CLOCK_SKEW_SECONDS)
                .build();
    }

    public String issueAccess(User user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().value())
                .issuer(issuer)
                .audience().add(audience).and()
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(accessTtl)))
                .signWith(accessKey, Jwts.SIG.HS256)
                .compact();
    }

    public String issueRefresh(User user) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(user.getId().toString())
                .claim(CLAIM_TYPE, REFRESH_TYPE)
                .issuer(issuer)
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(refreshTtl)))
                .signWith(refreshKey, Jwts.SIG.HS256)
                .compact();
    }

    public AccessClaims verifyAccess(String token) {
        Claims claims = parse(accessParser, token, "access");
        String subject = claims.getSubject();
        String email = claims.get(CLAIM_EMAIL, String.class);
        String roleValue = claims.get(CLAIM_ROLE, String.class);
        if (subject == null || subject.isBlank() || email == null || roleValue == null) {
            throw new InvalidTokenException("Access token is missing required claims");
        }
        UserRole role;
        try {
            role = UserRole.fromValue(roleValue);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Access token carries an unknown role", e);
        }
        if (role == null) {
            throw new InvalidTokenException("Access token is missing required claims");
        }
        return new AccessClaims(subject, email, role, claims.getId(), claims.getExpiration().toInstant());
    }

    /** Returns the user id of a valid refresh token. */
    public String verifyRefresh(String token) {
        Claims claims = parse(refreshParser, token, "refresh");
        if (!REFRESH_TYPE.equals(claims.get(CLAIM_TYPE, String.class))) {
            throw new InvalidTokenException("Not a refresh token");
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Refresh token has no subject");
        }
        return subject;
    }

    /**
     * Reads {@code exp} without checking the signature. Only for sizing blacklist
     * entries of tokens that were already verified on the way in.
     */
    public Optional<Instant> readExpiryUnverified(String token) {
        if (token == null) return Optional.empty();
        String[] parts = token.split("\\.");
        if (parts.length != 3) return Optional.empty();
        try {
            byte[] json = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode exp = PAYLOAD_READER.readTree(new String(json, StandardCharsets.UTF_8)).get("exp");
            if (exp == null || !exp.canConvertToLong()) return Optional.empty();
            return Optional.of(Instant.ofEpochSecond(exp.asLong()));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Cannot read expiry from token payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration getRefreshTtl() {
        return refreshTtl;
    }

    /** How long past {@code exp} a token still verifies. */
    public Duration getClockSkew() {
        return Duration.ofSeconds(CLOCK_SKEW_SECONDS);
    }

    private Claims parse(JwtParser parser, String token, String kind) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing " + kind + " token");
        }
        try {
            return parser.parseSignedClaims(token).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid {} token: {}", kind, e.getMessage());
            throw new InvalidTokenException("Invalid " + kind + " token", e);
        }
    }

    private static byte[] decodeSecret(String property, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(property + " must be provided (base64).");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (RuntimeException e) {
            throw new IllegalStateException(property + " must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < 32) {
            throw new IllegalStateException(property + " too short for HS256. Provide >= 256-bit Base64 key.");
        }
        return keyBytes;
    }
}
