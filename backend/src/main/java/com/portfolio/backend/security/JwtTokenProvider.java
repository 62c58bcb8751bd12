package com.portfolio.backend.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import jakarta.annotation.PostConstruct;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies HS256 access tokens. The subject is the user id; the email travels as a claim.
 */
@Component
public class JwtTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(JwtTokenProvider.class);

    static final String EMAIL_CLAIM = "email";

    @Value("${jwt.secret:}")
    private String jwtSecret;

    @Value("${jwt.expiration:1800000}")
    private long jwtExpirationMs;

    private SecretKey signingKey;

    public JwtTokenProvider() {
    }

    JwtTokenProvider(String jwtSecret, long jwtExpirationMs) {
        this.jwtSecret = jwtSecret;
        this.jwtExpirationMs = jwtExpirationMs;
        validateSecret();
    }

    @PostConstruct
    public void validateSecret() {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            logger.error("Missing JWT secret. Set JWT_SECRET environment variable. Using an ephemeral key.");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
        if (jwtSecret.length() < 32) {
            logger.error("JWT secret must be at least 32 characters. Using an ephemeral key.");
            jwtSecret = UUID.randomUUID() + UUID.randomUUID().toString();
        }
        signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(Long userId, String email) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(EMAIL_CLAIM, email)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Parses a token and returns its claims when the signature and expiry check out.
     */
    public Optional<TokenClaims> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String subject = claims.getSubject();
            if (subject == null) {
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(Long.valueOf(subject), claims.get(EMAIL_CLAIM, String.class)));
        } catch (JwtException | IllegalArgumentException ex) {
            logger.warn("JWT verification failed: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    public long getExpirationMs() {
        return jwtExpirationMs;
    }

    public record TokenClaims(Long userId, String email) {
    }
}
