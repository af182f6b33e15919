package com.molcollab.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.RecordingException;
import com.molcollab.model.ParticipantInfo;
import com.molcollab.model.Recording;
import com.molcollab.model.RoomEvent;
import com.molcollab.model.RoomEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Captures a room's state-affecting events while recording is on.
 * <p>
 * Owned by a single room and only called from that room's actor, so it needs no locking.
 * Events are kept in call order; relative times come from the injected clock in whole
 * milliseconds.
 */
public class Recorder {

    private static final Logger logger = LoggerFactory.getLogger(Recorder.class);

    private final String roomId;
    private final String subjectId;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final int checkpointEvery;

    private boolean active;
    private String recordingId;
    private long startMillis;
    private List<RoomEvent> events = new ArrayList<>();
    private int eventsSinceCheckpoint;

    public Recorder(String roomId, String subjectId, Clock clock, ObjectMapper objectMapper, int checkpointEvery) {
        this.roomId = roomId;
        this.subjectId = subjectId;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.checkpointEvery = Math.max(0, checkpointEvery);
    }

    /**
     * Begin a new recording anchored on the given state and roster.
     *
     * @return the new recording id
     * @throws RecordingException {@code REC_001} when a recording is already running
     */
    public String start(ObjectNode state, List<ParticipantInfo> roster) {
        if (active) {
            throw new RecordingException(ErrorCode.REC_001, recordingId);
        }
        active = true;
        recordingId = UUID.randomUUID().toString();
        events = new ArrayList<>();
        startMillis = clock.millis();
        appendSnapshot(state, roster);

        logger.info("Recording {} started in room {}", recordingId, roomId);
        return recordingId;
    }

    /**
     * Freeze the log into a {@link Recording}. No-op when not recording.
     */
    public Optional<Recording> stop(List<ParticipantInfo> participantsAtClose) {
        if (!active) {
            return Optional.empty();
        }
        double durationMs = clock.millis() - startMillis;
        Recording recording = new Recording(recordingId, roomId, subjectId, durationMs, events, participantsAtClose);

        logger.info("Recording {} stopped in room {} ({} events, {} ms)",
                recordingId, roomId, recording.eventCount(), (long) durationMs);

        active = false;
        recordingId = null;
        events = new ArrayList<>();
        eventsSinceCheckpoint = 0;
        return Optional.of(recording);
    }

    /**
     * Append an event stamped with the current time. No-op when not recording.
     */
    public void recordEvent(RoomEventType type, String originUserId, JsonNode payload) {
        if (!active) {
            return;
        }
        long now = clock.millis();
        events.add(new RoomEvent(now, now - startMillis, type, originUserId, payload));
        eventsSinceCheckpoint++;
    }

    /**
     * Append a checkpoint snapshot when the configured number of events has accumulated
     * since the last one.
     */
    public void checkpointIfDue(ObjectNode state, List<ParticipantInfo> roster) {
        if (active && checkpointEvery > 0 && eventsSinceCheckpoint >= checkpointEvery) {
            appendSnapshot(state, roster);
            logger.debug("Checkpoint written to recording {} at event {}", recordingId, events.size());
        }
    }

    public boolean isActive() {
        return active;
    }

    public int getEventCount() {
        return events.size();
    }

    private void appendSnapshot(ObjectNode state, List<ParticipantInfo> roster) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("roomId", roomId);
        payload.put("subjectId", subjectId);
        payload.set("state", state);
        payload.set("participants", objectMapper.valueToTree(roster));

        long now = clock.millis();
        events.add(new RoomEvent(now, now - startMillis, RoomEventType.STATE_SNAPSHOT, "", payload));
        eventsSinceCheckpoint = 0;
    }
}
