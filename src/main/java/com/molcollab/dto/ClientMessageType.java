package com.molcollab.dto;

import java.util.Optional;

/**
 * Message kinds a client may send. Anything else is rejected as malformed.
 */
public enum ClientMessageType {
    HANDSHAKE("handshake"),
    CURSOR_UPDATE("cursor-update"),
    SELECTION_UPDATE("selection-update"),
    STATE_UPDATE("state-update"),
    CHAT_MESSAGE("chat-message"),
    CAMERA_UPDATE("camera-update"),
    ANNOTATION_ADDED("annotation-added");

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<ClientMessageType> fromWireName(String name) {
        for (ClientMessageType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
