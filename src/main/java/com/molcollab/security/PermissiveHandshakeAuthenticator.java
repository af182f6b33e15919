package com.molcollab.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Development authenticator: any non-blank token is accepted and the client's user id is trusted.
 */
@Component
@ConditionalOnProperty(prefix = "molcollab.auth", name = "mode", havingValue = "permissive")
public class PermissiveHandshakeAuthenticator implements HandshakeAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(PermissiveHandshakeAuthenticator.class);

    public PermissiveHandshakeAuthenticator() {
        log.warn("Permissive handshake authentication enabled; do not use in production");
    }

    @Override
    public Optional<String> authenticate(String token, String claimedUserId) {
        if (token == null || token.isBlank() || claimedUserId == null || claimedUserId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(claimedUserId);
    }
}
