package ru.tigran.nationalityengine.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Service for JWT token generation and validation.
 * Subject is the user ID, the username goes into a separate claim.
 * Uses HMAC-SHA256 for token signing.
 */
@Slf4j
@Service
public class JwtTokenProvider {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String USERNAME_CLAIM = "username";

    private final SecretKey key;
    private final long tokenValidityInMilliseconds;

    public JwtTokenProvider(
            @Value("${app.jwt.secret-key}") String secretKey,
            @Value("${app.jwt.expiration-hours:24}") int expirationHours
    ) {
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        this.tokenValidityInMilliseconds = expirationHours * 60L * 60 * 1000;
    }

    public long getTokenValiditySeconds() {
        return tokenValidityInMilliseconds / 1000;
    }

    /**
     * Generates a JWT token for the given user.
     *
     * @param userId User ID to encode as subject
     * @param username Username to encode as claim
     * @return JWT token string
     */
    public String generateToken(Long userId, String username) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + tokenValidityInMilliseconds);

        String token = Jwts.builder()
                .subject(userId.toString())
                .claim(USERNAME_CLAIM, username)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(key)
                .compact();

        log.debug("Generated JWT token for user: {}", userId);
        return token;
    }

    /**
     * Validates JWT token and returns the user ID (subject).
     *
     * @throws JwtException if token is invalid or expired
     */
    public Long getUserIdFromToken(String token) {
        Claims claims = parseClaims(token);
        return Long.parseLong(claims.getSubject());
    }

    public boolean validateToken(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT token validation failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Extracts the Bearer token from Authorization header.
     *
     * @param authHeader Authorization header value (e.g., "Bearer <token>")
     * @return Token string without "Bearer " prefix, or null if header is invalid
     */
    public String extractTokenFromHeader(String authHeader) {
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            return authHeader.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
