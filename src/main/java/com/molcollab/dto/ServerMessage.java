package com.molcollab.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.molcollab.model.ParticipantInfo;
import com.molcollab.model.Role;
import com.molcollab.model.RoomSummary;
import com.molcollab.model.Vector3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server to client frame: a {@code type} tag plus type-specific fields, serialized flat.
 */
@JsonPropertyOrder({"type"})
public final class ServerMessage {

    private final String type;
    private final Map<String, Object> fields;

    private ServerMessage(String type, Map<String, Object> fields) {
        this.type = type;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public String getType() {
        return type;
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    @Override
    public String toString() {
        return type + fields;
    }

    public static ServerMessage roomCreated(String roomId, String sessionId, Role role) {
        return builder("room-created")
                .with("roomId", roomId)
                .with("sessionId", sessionId)
                .with("role", role)
                .build();
    }

    public static ServerMessage roomJoined(String roomId, String sessionId, Role role,
                                           Object state, List<ParticipantInfo> participants) {
        return builder("room-joined")
                .with("roomId", roomId)
                .with("sessionId", sessionId)
                .with("role", role)
                .with("state", state)
                .with("participants", participants)
                .build();
    }

    public static ServerMessage roomList(List<RoomSummary> rooms) {
        return builder("room-list").with("rooms", rooms).build();
    }

    public static ServerMessage handshakeError(String error) {
        return builder("handshake-error").with("error", error).build();
    }

    public static ServerMessage error(ErrorResponse.ErrorCode code, String details) {
        return builder("error")
                .with("code", code.getCode())
                .with("message", details == null ? code.getMessage() : code.getMessage() + ": " + details)
                .build();
    }

    public static ServerMessage crdtUpdate(int[] update, String origin) {
        return builder("crdt-update").with("update", update).with("origin", origin).build();
    }

    public static ServerMessage participantJoined(ParticipantInfo participant) {
        return builder("participant-joined").with("participant", participant).build();
    }

    public static ServerMessage participantLeft(String sessionId, String userId) {
        return builder("participant-left").with("sessionId", sessionId).with("userId", userId).build();
    }

    public static ServerMessage cursorUpdate(String userId, String sessionId, Vector3 cursor) {
        return builder("cursor-update")
                .with("userId", userId)
                .with("sessionId", sessionId)
                .with("cursor", cursor)
                .build();
    }

    public static ServerMessage selectionUpdate(String userId, String sessionId, List<Integer> selection) {
        return builder("selection-update")
                .with("userId", userId)
                .with("sessionId", sessionId)
                .with("selection", selection)
                .build();
    }

    public static ServerMessage chatMessage(String userId, String username, String message, long timestamp) {
        return builder("chat-message")
                .with("userId", userId)
                .with("username", username)
                .with("message", message)
                .with("timestamp", timestamp)
                .build();
    }

    public static ServerMessage cameraUpdate(String userId, Object camera) {
        return builder("camera-update").with("userId", userId).with("camera", camera).build();
    }

    public static ServerMessage annotationAdded(String userId, Object annotation) {
        return builder("annotation-added").with("userId", userId).with("annotation", annotation).build();
    }

    public static ServerMessage recordingStarted(String recordingId) {
        return builder("recording-started").with("recordingId", recordingId).build();
    }

    public static ServerMessage recordingStopped(String recordingId) {
        return builder("recording-stopped").with("recordingId", recordingId).build();
    }

    public static ServerMessage roomClosed(String roomId) {
        return builder("room-closed").with("roomId", roomId).build();
    }

    private static Builder builder(String type) {
        return new Builder(type);
    }

    private static final class Builder {
        private final String type;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        private Builder with(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        private ServerMessage build() {
            return new ServerMessage(type, fields);
        }
    }
}
