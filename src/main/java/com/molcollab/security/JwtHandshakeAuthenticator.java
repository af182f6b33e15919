package com.molcollab.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Accepts handshakes whose token is a valid JWT; the token subject is the user id.
 * A client claiming a different user id than its token is rejected.
 */
@Component
@ConditionalOnProperty(prefix = "molcollab.auth", name = "mode", havingValue = "jwt", matchIfMissing = true)
public class JwtHandshakeAuthenticator implements HandshakeAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(JwtHandshakeAuthenticator.class);

    private final JwtService jwtService;

    public JwtHandshakeAuthenticator(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    public Optional<String> authenticate(String token, String claimedUserId) {
        if (token == null || token.isBlank()) {
            log.debug("No token provided in handshake");
            return Optional.empty();
        }

        try {
            Claims claims = jwtService.validateToken(token);
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Handshake token has no subject");
                return Optional.empty();
            }
            if (claimedUserId != null && !claimedUserId.equals(subject)) {
                log.debug("Handshake userId {} does not match token subject {}", claimedUserId, subject);
                return Optional.empty();
            }
            return Optional.of(subject);
        } catch (JwtException e) {
            log.debug("Handshake authentication failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
