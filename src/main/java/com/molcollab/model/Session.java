package com.molcollab.model;

import com.molcollab.dto.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One participant's live connection inside a room, with its transient presence
 * (cursor and selection). Holds only the room id, never the room itself.
 */
public class Session {

    private static final Logger logger = LoggerFactory.getLogger(Session.class);

    private final String sessionId;
    private final String userId;
    private final String roomId;
    private final Role role;
    private final Instant connectedAt;
    private final SessionSink sink;

    private volatile Vector3 cursor = Vector3.ORIGIN;
    private volatile Set<Integer> selection = Set.of();

    public Session(String sessionId, String userId, String roomId, Role role, Instant connectedAt, SessionSink sink) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.roomId = roomId;
        this.role = role;
        this.connectedAt = connectedAt;
        this.sink = sink;
    }

    /**
     * Deliver a message. A failing connection never breaks the caller's fan-out loop.
     */
    public void send(ServerMessage message) {
        try {
            sink.send(message);
        } catch (RuntimeException e) {
            logger.warn("Failed to send {} to session {}: {}", message.getType(), sessionId, e.getMessage());
        }
    }

    public ParticipantInfo toParticipantInfo() {
        return new ParticipantInfo(userId, sessionId, role, cursor, new ArrayList<>(selection));
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRoomId() {
        return roomId;
    }

    public Role getRole() {
        return role;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Vector3 getCursor() {
        return cursor;
    }

    public void setCursor(Vector3 cursor) {
        this.cursor = cursor;
    }

    public Set<Integer> getSelection() {
        return selection;
    }

    public void setSelection(Iterable<Integer> indices) {
        Set<Integer> copy = new LinkedHashSet<>();
        indices.forEach(copy::add);
        this.selection = Collections.unmodifiableSet(copy);
    }
}
