package com.molcollab.dto;

import java.util.Optional;

public enum HandshakeAction {
    CREATE_ROOM("create-room"),
    JOIN_ROOM("join-room"),
    LIST_ROOMS("list-rooms");

    private final String wireName;

    HandshakeAction(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<HandshakeAction> fromWireName(String name) {
        for (HandshakeAction action : values()) {
            if (action.wireName.equals(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
