package com.molcollab.security;

import java.util.Optional;

/**
 * Pass/fail check of the token carried by a WebSocket handshake.
 */
public interface HandshakeAuthenticator {

    /**
     * @param token         token from the handshake message, may be {@code null}
     * @param claimedUserId user id the client says it has, may be {@code null}
     * @return the authenticated user id, or empty to reject the handshake
     */
    Optional<String> authenticate(String token, String claimedUserId);
}
