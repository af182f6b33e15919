package com.molcollab.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.codec.UpdateBytes;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.ServerMessage;
import com.molcollab.exception.MessageException;
import com.molcollab.exception.RecordingException;
import com.molcollab.exception.RoomException;
import com.molcollab.service.Recorder;
import com.molcollab.service.RoomMailbox;
import com.molcollab.state.SharedStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * A collaborative session around one subject document.
 * <p>
 * Every operation is queued on the room's mailbox and runs alone, in arrival order. That
 * single-writer discipline is what keeps the shared store, the roster and the recorded event
 * log consistent with each other. Failures inside an operation are reported to the session
 * that triggered it and never stop the mailbox.
 */
public class Room {

    private static final Logger logger = LoggerFactory.getLogger(Room.class);

    private final String roomId;
    private final String ownerId;
    private final String subjectId;
    private final SharedStateStore sharedState;
    private final Recorder recorder;
    private final RoomMailbox mailbox;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Lifecycle lifecycle;

    // Mutated only on the mailbox
    private final Map<String, Session> participants = new LinkedHashMap<>();
    private boolean closed;

    // Read from other threads (registry, listings)
    private volatile int participantCount;
    private volatile boolean recording;
    private final AtomicInteger pendingJoins = new AtomicInteger();

    /**
     * Callbacks from a room to whoever owns it.
     */
    public interface Lifecycle {

        /**
         * Called on the room's mailbox when the last participant has left.
         *
         * @return {@code true} if the room was removed and must shut down
         */
        boolean onEmpty(Room room);

        default void onRecordingStarted(String recordingId) {
        }

        void onRecordingFinalized(Recording recording);
    }

    public Room(String roomId, String ownerId, String subjectId, SharedStateStore sharedState,
                Recorder recorder, RoomMailbox mailbox, Clock clock, ObjectMapper objectMapper,
                Lifecycle lifecycle) {
        this.roomId = roomId;
        this.ownerId = ownerId;
        this.subjectId = subjectId;
        this.sharedState = sharedState;
        this.recorder = recorder;
        this.mailbox = mailbox;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.lifecycle = lifecycle;

        this.sharedState.addUpdateListener(this::onSharedStateUpdate);
    }

    // ---------------------------------------------------------------- roster

    /**
     * Reserve a slot for a join that has been accepted but not yet processed. Keeps the room
     * alive if its roster empties in between.
     */
    public void reserveJoin() {
        pendingJoins.incrementAndGet();
    }

    public boolean isIdle() {
        return participantCount == 0 && pendingJoins.get() == 0;
    }

    public void addParticipant(Session session) {
        mailbox.execute(() -> {
            pendingJoins.updateAndGet(n -> Math.max(0, n - 1));
            if (closed) {
                session.send(ServerMessage.handshakeError(ErrorCode.ROOM_001.getMessage()));
                return;
            }
            guarded(session.getSessionId(), "add-participant", () -> doAddParticipant(session));
        });
    }

    public void removeParticipant(String sessionId) {
        submit(null, "remove-participant", () -> doRemoveParticipant(sessionId));
    }

    private void doAddParticipant(Session session) {
        participants.put(session.getSessionId(), session);
        participantCount = participants.size();

        session.send(ServerMessage.roomJoined(roomId, session.getSessionId(), session.getRole(),
                sharedState.snapshot(), roster()));

        ParticipantInfo info = session.toParticipantInfo();
        broadcast(ServerMessage.participantJoined(info), session.getSessionId());
        record(RoomEventType.PARTICIPANT_JOINED, session.getUserId(), objectMapper.valueToTree(info));

        logger.info("Participant {} (user {}, {}) joined room {} ({} present)",
                session.getSessionId(), session.getUserId(), session.getRole().getWireName(),
                roomId, participants.size());
    }

    private void doRemoveParticipant(String sessionId) {
        Session session = participants.remove(sessionId);
        if (session == null) {
            return;
        }
        participantCount = participants.size();

        broadcast(ServerMessage.participantLeft(sessionId, session.getUserId()), null);
        ObjectNode payload = objectMapper.createObjectNode()
                .put("sessionId", sessionId)
                .put("userId", session.getUserId());
        record(RoomEventType.PARTICIPANT_LEFT, session.getUserId(), payload);

        logger.info("Participant {} left room {} ({} remaining)", sessionId, roomId, participants.size());

        if (participants.isEmpty() && lifecycle.onEmpty(this)) {
            doClose();
        }
    }

    // ---------------------------------------------------------------- document

    /**
     * Merge an update from a session into the shared document. The resulting
     * {@code crdt-update} reaches every other session.
     */
    public void applyUpdate(String sessionId, byte[] update) {
        submit(sessionId, "state-update", () -> {
            requireParticipant(sessionId);
            sharedState.applyUpdate(update, sessionId);
        });
    }

    private void onSharedStateUpdate(byte[] update, String originSessionId) {
        Session origin = originSessionId == null ? null : participants.get(originSessionId);
        String originUserId = origin != null ? origin.getUserId() : null;

        broadcast(ServerMessage.crdtUpdate(UpdateBytes.toUnsigned(update), originUserId), originSessionId);

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("sessionId", originSessionId);
        payload.set("update", UpdateBytes.toJson(update));
        record(RoomEventType.CRDT_UPDATE, originUserId, payload);
    }

    /**
     * Current document, read on the mailbox so it reflects every operation queued before it.
     */
    public CompletableFuture<ObjectNode> currentState() {
        return call(sharedState::snapshot);
    }

    // ---------------------------------------------------------------- presence

    public void updateCursor(String sessionId, Vector3 cursor) {
        submit(sessionId, "cursor-update", () -> {
            Session session = requireParticipant(sessionId);
            session.setCursor(cursor);
            broadcast(ServerMessage.cursorUpdate(session.getUserId(), sessionId, cursor), sessionId);

            ObjectNode payload = objectMapper.createObjectNode().put("sessionId", sessionId);
            payload.set("cursor", objectMapper.valueToTree(cursor));
            record(RoomEventType.CURSOR_UPDATE, session.getUserId(), payload);
        });
    }

    public void updateSelection(String sessionId, List<Integer> selection) {
        submit(sessionId, "selection-update", () -> {
            Session session = requireParticipant(sessionId);
            session.setSelection(selection);
            List<Integer> normalized = new ArrayList<>(session.getSelection());
            broadcast(ServerMessage.selectionUpdate(session.getUserId(), sessionId, normalized), sessionId);

            ObjectNode payload = objectMapper.createObjectNode().put("sessionId", sessionId);
            payload.set("selection", objectMapper.valueToTree(normalized));
            record(RoomEventType.SELECTION_UPDATE, session.getUserId(), payload);
        });
    }

    // ---------------------------------------------------------------- chat and scene notes

    /**
     * Fan a chat line out to everyone, sender included, stamped with server time.
     */
    public void broadcastChat(String sessionId, String username, String text) {
        submit(sessionId, "chat-message", () -> {
            Session session = requireParticipant(sessionId);
            long timestamp = clock.millis();
            broadcast(ServerMessage.chatMessage(session.getUserId(), username, text, timestamp), null);

            ObjectNode payload = objectMapper.createObjectNode()
                    .put("sessionId", sessionId)
                    .put("username", username)
                    .put("message", text)
                    .put("timestamp", timestamp);
            record(RoomEventType.CHAT_MESSAGE, session.getUserId(), payload);
        });
    }

    public void updateCamera(String sessionId, JsonNode camera) {
        submit(sessionId, "camera-update", () -> {
            Session session = requireParticipant(sessionId);
            broadcast(ServerMessage.cameraUpdate(session.getUserId(), camera), sessionId);

            ObjectNode payload = objectMapper.createObjectNode().put("sessionId", sessionId);
            payload.set("camera", camera);
            record(RoomEventType.CAMERA_UPDATE, session.getUserId(), payload);
        });
    }

    public void addAnnotation(String sessionId, JsonNode annotation) {
        submit(sessionId, "annotation-added", () -> {
            Session session = requireParticipant(sessionId);
            broadcast(ServerMessage.annotationAdded(session.getUserId(), annotation), sessionId);

            ObjectNode payload = objectMapper.createObjectNode().put("sessionId", sessionId);
            payload.set("annotation", annotation);
            record(RoomEventType.ANNOTATION_ADDED, session.getUserId(), payload);
        });
    }

    // ---------------------------------------------------------------- recording

    /**
     * @return a future completing with the new recording id, or failing with
     *         {@code REC_001} when the room is already recording
     */
    public CompletableFuture<String> startRecording() {
        return call(() -> {
            String recordingId = recorder.start(sharedState.snapshot(), roster());
            recording = true;
            lifecycle.onRecordingStarted(recordingId);
            broadcast(ServerMessage.recordingStarted(recordingId), null);
            return recordingId;
        });
    }

    /**
     * @return a future completing with the finalized recording, or empty when the room was
     *         not recording
     */
    public CompletableFuture<Optional<Recording>> stopRecording() {
        return call(() -> {
            Optional<Recording> finalized = finalizeRecording();
            finalized.ifPresent(r -> broadcast(ServerMessage.recordingStopped(r.recordingId()), null));
            return finalized;
        });
    }

    private Optional<Recording> finalizeRecording() {
        Optional<Recording> finalized = recorder.stop(roster());
        recording = false;
        finalized.ifPresent(lifecycle::onRecordingFinalized);
        return finalized;
    }

    private void record(RoomEventType type, String originUserId, JsonNode payload) {
        if (!recorder.isActive()) {
            return;
        }
        recorder.recordEvent(type, originUserId, payload);
        recorder.checkpointIfDue(sharedState.snapshot(), roster());
    }

    // ---------------------------------------------------------------- shutdown

    /**
     * Finalize any running recording, tell remaining participants and release the document.
     * Idempotent.
     */
    public void close() {
        submit(null, "close", this::doClose);
    }

    private void doClose() {
        if (closed) {
            return;
        }
        finalizeRecording();
        broadcast(ServerMessage.roomClosed(roomId), null);
        participants.clear();
        participantCount = 0;
        sharedState.close();
        closed = true;
        logger.info("Room {} closed", roomId);
    }

    // ---------------------------------------------------------------- plumbing

    private void broadcast(ServerMessage message, String excludeSessionId) {
        for (Session session : participants.values()) {
            if (!session.getSessionId().equals(excludeSessionId)) {
                session.send(message);
            }
        }
    }

    private List<ParticipantInfo> roster() {
        List<ParticipantInfo> roster = new ArrayList<>(participants.size());
        for (Session session : participants.values()) {
            roster.add(session.toParticipantInfo());
        }
        return roster;
    }

    private Session requireParticipant(String sessionId) {
        Session session = participants.get(sessionId);
        if (session == null) {
            throw new RoomException(ErrorCode.ROOM_001, "session " + sessionId + " is not in room " + roomId);
        }
        return session;
    }

    private void submit(String originSessionId, String operation, Runnable task) {
        mailbox.execute(() -> {
            if (closed) {
                logger.debug("Dropping {} for closed room {}", operation, roomId);
                return;
            }
            guarded(originSessionId, operation, task);
        });
    }

    private void guarded(String originSessionId, String operation, Runnable task) {
        try {
            task.run();
        } catch (MessageException e) {
            logger.warn("Rejected {} in room {}: {}", operation, roomId, e.getMessage());
            replyError(originSessionId, e.getErrorCode(), e.getDetails());
        } catch (RoomException e) {
            logger.warn("Rejected {} in room {}: {}", operation, roomId, e.getMessage());
            replyError(originSessionId, e.getErrorCode(), e.getDetails());
        } catch (RuntimeException e) {
            logger.error("Unexpected error during {} in room {}", operation, roomId, e);
            replyError(originSessionId, ErrorCode.SRV_001, null);
        }
    }

    private void replyError(String sessionId, ErrorCode code, String details) {
        if (sessionId == null) {
            return;
        }
        Session session = participants.get(sessionId);
        if (session != null) {
            session.send(ServerMessage.error(code, details));
        }
    }

    private <T> CompletableFuture<T> call(Supplier<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        mailbox.execute(() -> {
            if (closed) {
                result.completeExceptionally(new RoomException(ErrorCode.ROOM_001, roomId));
                return;
            }
            try {
                result.complete(work.get());
            } catch (RecordingException | RoomException e) {
                result.completeExceptionally(e);
            } catch (RuntimeException e) {
                logger.error("Unexpected error in room {}", roomId, e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    // ---------------------------------------------------------------- accessors

    public RoomSummary summary() {
        return new RoomSummary(roomId, subjectId, participantCount, recording);
    }

    public String getRoomId() {
        return roomId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    public boolean isRecording() {
        return recording;
    }
}
