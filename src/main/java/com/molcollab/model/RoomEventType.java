package com.molcollab.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of recordable event kinds. The declaration order is the one-byte type index
 * used by the binary event layout; append new kinds at the end only.
 */
public enum RoomEventType {
    STATE_SNAPSHOT("state-snapshot"),
    CURSOR_UPDATE("cursor-update"),
    SELECTION_UPDATE("selection-update"),
    CRDT_UPDATE("crdt-update"),
    CHAT_MESSAGE("chat-message"),
    PARTICIPANT_JOINED("participant-joined"),
    PARTICIPANT_LEFT("participant-left"),
    CAMERA_UPDATE("camera-update"),
    ANNOTATION_ADDED("annotation-added");

    private static final RoomEventType[] BY_INDEX = values();

    private final String wireName;

    RoomEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int index() {
        return ordinal();
    }

    /**
     * @return the type for a wire index, or {@code null} when the index is out of range
     */
    public static RoomEventType fromIndex(int index) {
        if (index < 0 || index >= BY_INDEX.length) {
            return null;
        }
        return BY_INDEX[index];
    }
}
