package com.molcollab.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Date;

/**
 * JWT signing and validation for handshake tokens and REST bearer tokens.
 * Token issuance for real users happens elsewhere; {@link #generateAccessToken} serves
 * development tooling and tests.
 */
@Service
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKey signingKey;
    private final long accessTokenExpiration;
    private final String issuer;

    public JwtService(
            @Value("${security.jwt.secret:}") String secret,
            @Value("${security.jwt.access-token-expiration:900000}") long accessTokenExpiration,
            @Value("${security.jwt.issuer:molcollab}") String issuer) {

        // No secret configured: random key, tokens won't survive restarts
        if (secret == null || secret.isBlank()) {
            byte[] randomKey = new byte[64];
            SECURE_RANDOM.nextBytes(randomKey);
            secret = Base64.getEncoder().encodeToString(randomKey);
            log.warn("JWT_SECRET not set, generated a random signing key. Tokens will NOT survive restarts.");
        }

        // HS256 needs at least 256 bits
        if (secret.length() < 32) {
            throw new IllegalArgumentException("JWT secret must be at least 256 bits (32 characters)");
        }

        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpiration = accessTokenExpiration;
        this.issuer = issuer;

        log.info("JwtService initialized with issuer {} and {} ms token expiration", issuer, accessTokenExpiration);
    }

    public String generateAccessToken(String userId, String role) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + accessTokenExpiration);

        return Jwts.builder()
                .claim("role", role)
                .subject(userId)
                .issuer(issuer)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Validate a token and return its claims.
     *
     * @throws JwtException if the token is malformed, badly signed, expired or from another issuer
     */
    public Claims validateToken(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(issuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.debug("Token expired: {}", e.getMessage());
            throw e;
        } catch (JwtException e) {
            log.debug("Invalid token: {}", e.getMessage());
            throw e;
        }
    }
}
