package com.molcollab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Parsed client frame. Handshake fields are only populated for {@link ClientMessageType#HANDSHAKE}.
 */
public record ClientMessage(
        ClientMessageType type,
        HandshakeAction action,
        String userId,
        String roomId,
        String subjectId,
        String token,
        JsonNode payload
) {
    public ClientMessage {
        if (payload == null) payload = MissingNode.getInstance();
    }

    public static ClientMessage of(ClientMessageType type, JsonNode payload) {
        return new ClientMessage(type, null, null, null, null, null, payload);
    }

    public static ClientMessage handshake(HandshakeAction action, String userId, String roomId,
                                          String subjectId, String token) {
        return new ClientMessage(ClientMessageType.HANDSHAKE, action, userId, roomId, subjectId, token, null);
    }
}
