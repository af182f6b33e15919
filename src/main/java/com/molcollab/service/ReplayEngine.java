package com.molcollab.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.codec.UpdateBytes;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.MessageException;
import com.molcollab.exception.ReplayException;
import com.molcollab.model.ParticipantInfo;
import com.molcollab.model.PlaybackState;
import com.molcollab.model.Recording;
import com.molcollab.model.ReplayStatistics;
import com.molcollab.model.RoomEvent;
import com.molcollab.model.RoomEventType;
import com.molcollab.model.Vector3;
import com.molcollab.state.SharedStateStore;
import com.molcollab.state.SharedStateStoreFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconstructs a recording's state at any instant and drives timed playback.
 * <p>
 * Playback is cooperative: {@link #tick()} applies every event whose time has come and must
 * be called periodically by whoever owns the engine. Seeking restores from the nearest
 * preceding snapshot and replays forward, so the result never depends on earlier seeks.
 * All public methods are synchronized; an engine may be driven by a scheduler and
 * controlled from request threads at the same time.
 */
public class ReplayEngine {

    private static final Logger logger = LoggerFactory.getLogger(ReplayEngine.class);

    public static final double DEFAULT_MIN_SPEED = 0.1;
    public static final double DEFAULT_MAX_SPEED = 10.0;

    private final SharedStateStoreFactory stateStoreFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final double minSpeed;
    private final double maxSpeed;

    private Recording recording;
    private List<RoomEvent> events = List.of();
    private double durationMs;
    private ReplayListener listener = ReplayListener.NONE;

    private int cursorIndex;
    private PlaybackState playbackState = PlaybackState.STOPPED;
    private double speedMultiplier = 1.0;
    // Wall time (ms) at which virtual time 0 would have started at the current speed
    private double virtualClockOriginMs;
    // Virtual time while not playing
    private double positionMs;

    private SharedStateStore reconstructedState;
    private final Map<String, ParticipantInfo> participantsView = new LinkedHashMap<>();
    private final Map<String, Vector3> cursorsView = new LinkedHashMap<>();
    private final Map<String, List<Integer>> selectionsView = new LinkedHashMap<>();
    private final Map<String, JsonNode> camerasView = new LinkedHashMap<>();
    private final List<JsonNode> annotationsView = new ArrayList<>();

    public ReplayEngine(SharedStateStoreFactory stateStoreFactory, ObjectMapper objectMapper, Clock clock) {
        this(stateStoreFactory, objectMapper, clock, DEFAULT_MIN_SPEED, DEFAULT_MAX_SPEED);
    }

    public ReplayEngine(SharedStateStoreFactory stateStoreFactory, ObjectMapper objectMapper, Clock clock,
                        double minSpeed, double maxSpeed) {
        this.stateStoreFactory = stateStoreFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.minSpeed = minSpeed;
        this.maxSpeed = maxSpeed;
    }

    /**
     * Load a recording and reconstruct its initial state.
     *
     * @throws ReplayException {@code RPL_002} if the recording is empty, does not start with a
     *                         state snapshot or has a broken timeline, {@code RPL_001} if that
     *                         snapshot is unreadable
     */
    public synchronized void load(Recording recording) {
        List<RoomEvent> loaded = recording.events();
        if (loaded.isEmpty()) {
            throw new ReplayException(ErrorCode.RPL_002, "Recording " + recording.recordingId() + " has no events");
        }
        if (loaded.get(0).type() != RoomEventType.STATE_SNAPSHOT) {
            throw new ReplayException(ErrorCode.RPL_002,
                    "First event of " + recording.recordingId() + " is " + loaded.get(0).type().getWireName());
        }

        requireOrderedTimeline(recording);

        this.recording = recording;
        this.events = loaded;
        this.durationMs = Math.max(recording.durationMs(), loaded.get(loaded.size() - 1).relativeTimeMs());
        this.playbackState = PlaybackState.STOPPED;
        this.speedMultiplier = 1.0;
        resetToInitial();

        logger.info("Replay loaded recording {} ({} events, {} ms)",
                recording.recordingId(), loaded.size(), (long) durationMs);
    }

    public synchronized void setListener(ReplayListener listener) {
        this.listener = listener == null ? ReplayListener.NONE : listener;
    }

    // ---------------------------------------------------------------- seeking

    /**
     * Reconstruct the state at {@code targetMs}: restore the latest snapshot at or before it,
     * then apply every later event up to and including {@code targetMs} in recorded order.
     * Negative targets are treated as 0 and targets past the end as the end. A seek that hits
     * an unreadable event leaves the replay stopped at its initial snapshot.
     */
    public synchronized void seek(double targetMs) {
        requireLoaded();
        if (Double.isNaN(targetMs)) {
            throw new IllegalArgumentException("Seek target must be a number");
        }
        double target = Math.min(Math.max(0, targetMs), durationMs);

        int snapshotIndex = 0;
        int lastIndex = -1;
        for (int i = 0; i < events.size(); i++) {
            RoomEvent event = events.get(i);
            if (event.relativeTimeMs() > target) {
                break;
            }
            lastIndex = i;
            if (event.type() == RoomEventType.STATE_SNAPSHOT) {
                snapshotIndex = i;
            }
        }

        try {
            restoreFromSnapshot(snapshotIndex);
            for (int i = snapshotIndex + 1; i <= lastIndex; i++) {
                applyEvent(i);
            }
        } catch (ReplayException e) {
            // A half-rebuilt document must not outlive the failed seek
            playbackState = PlaybackState.STOPPED;
            resetToInitial();
            throw e;
        }
        cursorIndex = Math.max(snapshotIndex, lastIndex) + 1;

        positionMs = target;
        if (playbackState == PlaybackState.PLAYING) {
            rebaseOrigin(target);
        }
        logger.debug("Replay of {} seeked to {} ms (cursor {})", recording.recordingId(), (long) target, cursorIndex);
    }

    /**
     * Seek to the recorded time of the event at {@code index}.
     */
    public synchronized void seekToEvent(int index) {
        requireLoaded();
        if (index < 0 || index >= events.size()) {
            throw new IllegalArgumentException("Event index " + index + " outside [0, " + events.size() + ")");
        }
        seek(events.get(index).relativeTimeMs());
    }

    // ---------------------------------------------------------------- playback

    /**
     * Start or resume playback from the current position. No-op while already playing.
     * A replay sitting at its end restarts from the beginning.
     */
    public synchronized void play() {
        requireLoaded();
        if (playbackState == PlaybackState.PLAYING) {
            return;
        }
        if (cursorIndex >= events.size()) {
            resetToInitial();
        }
        playbackState = PlaybackState.PLAYING;
        rebaseOrigin(positionMs);
        tick();
    }

    public synchronized void pause() {
        if (playbackState != PlaybackState.PLAYING) {
            return;
        }
        positionMs = currentVirtualTime();
        playbackState = PlaybackState.PAUSED;
    }

    /**
     * Stop and rewind to the initial snapshot.
     */
    public synchronized void stop() {
        requireLoaded();
        playbackState = PlaybackState.STOPPED;
        resetToInitial();
    }

    /**
     * Apply every event due at the current virtual time. Called periodically while playing;
     * does nothing otherwise.
     *
     * @return {@code true} if the replay is still playing afterwards
     */
    public synchronized boolean tick() {
        if (playbackState != PlaybackState.PLAYING) {
            return false;
        }
        double now = currentVirtualTime();
        while (cursorIndex < events.size() && events.get(cursorIndex).relativeTimeMs() <= now) {
            applyEvent(cursorIndex);
            cursorIndex++;
        }
        if (cursorIndex >= events.size()) {
            playbackState = PlaybackState.STOPPED;
            positionMs = durationMs;
            logger.debug("Replay of {} completed", recording.recordingId());
            listener.onPlaybackComplete();
            return false;
        }
        return true;
    }

    /**
     * Change speed, clamped to the configured range, keeping the elapsed virtual time.
     */
    public synchronized void setPlaybackSpeed(double multiplier) {
        if (Double.isNaN(multiplier)) {
            throw new IllegalArgumentException("Playback speed must be a number");
        }
        double clamped = Math.min(maxSpeed, Math.max(minSpeed, multiplier));
        if (playbackState == PlaybackState.PLAYING) {
            double current = currentVirtualTime();
            speedMultiplier = clamped;
            rebaseOrigin(current);
        } else {
            speedMultiplier = clamped;
        }
    }

    // ---------------------------------------------------------------- views

    public synchronized double getCurrentTimeMs() {
        return playbackState == PlaybackState.PLAYING ? currentVirtualTime() : positionMs;
    }

    /**
     * @return position within the recording in [0, 1]
     */
    public synchronized double getProgress() {
        requireLoaded();
        if (durationMs <= 0) {
            return cursorIndex >= events.size() ? 1.0 : 0.0;
        }
        return Math.min(1.0, getCurrentTimeMs() / durationMs);
    }

    public synchronized ObjectNode snapshot() {
        requireLoaded();
        return reconstructedState.snapshot();
    }

    /**
     * Reconstructed roster with presence merged in, keyed by session id.
     */
    public synchronized List<ParticipantInfo> getParticipants() {
        List<ParticipantInfo> roster = new ArrayList<>();
        for (ParticipantInfo info : participantsView.values()) {
            roster.add(new ParticipantInfo(info.userId(), info.sessionId(), info.role(),
                    cursorsView.getOrDefault(info.sessionId(), info.cursor()),
                    selectionsView.getOrDefault(info.sessionId(), info.selection())));
        }
        return roster;
    }

    public synchronized Map<String, Vector3> getCursors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cursorsView));
    }

    public synchronized Map<String, List<Integer>> getSelections() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(selectionsView));
    }

    public synchronized Map<String, JsonNode> getCameras() {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        camerasView.forEach((sessionId, camera) -> copy.put(sessionId, camera.deepCopy()));
        return copy;
    }

    public synchronized List<JsonNode> getAnnotations() {
        List<JsonNode> copy = new ArrayList<>();
        annotationsView.forEach(annotation -> copy.add(annotation.deepCopy()));
        return copy;
    }

    public synchronized ReplayStatistics statistics() {
        requireLoaded();
        Map<RoomEventType, Integer> counts = new EnumMap<>(RoomEventType.class);
        Set<String> sessions = new HashSet<>();
        int snapshots = 0;

        for (RoomEvent event : events) {
            counts.merge(event.type(), 1, Integer::sum);
            JsonNode payload = event.payload();
            if (event.type() == RoomEventType.STATE_SNAPSHOT) {
                snapshots++;
                for (JsonNode participant : payload.path("participants")) {
                    sessions.add(participant.path("sessionId").asText());
                }
            } else if (payload.hasNonNull("sessionId")) {
                sessions.add(payload.get("sessionId").asText());
            }
        }

        Map<String, Integer> byType = new LinkedHashMap<>();
        counts.forEach((type, count) -> byType.put(type.getWireName(), count));
        double eventsPerSecond = durationMs > 0 ? events.size() / (durationMs / 1000.0) : 0.0;

        return new ReplayStatistics(recording.recordingId(), durationMs, events.size(), byType,
                sessions.size(), snapshots, eventsPerSecond);
    }

    public synchronized PlaybackState getPlaybackState() {
        return playbackState;
    }

    public synchronized int getCursorIndex() {
        return cursorIndex;
    }

    public synchronized double getSpeedMultiplier() {
        return speedMultiplier;
    }

    public synchronized double getDurationMs() {
        return durationMs;
    }

    public synchronized int getEventCount() {
        return events.size();
    }

    public synchronized Recording getRecording() {
        return recording;
    }

    /**
     * Release the reconstructed document.
     */
    public synchronized void close() {
        playbackState = PlaybackState.STOPPED;
        if (reconstructedState != null) {
            reconstructedState.close();
            reconstructedState = null;
        }
    }

    // ---------------------------------------------------------------- internals

    private void resetToInitial() {
        restoreFromSnapshot(0);
        cursorIndex = 0;
        positionMs = 0;
    }

    private double currentVirtualTime() {
        double elapsed = (clock.millis() - virtualClockOriginMs) * speedMultiplier;
        return Math.min(Math.max(0, elapsed), durationMs);
    }

    private void rebaseOrigin(double virtualTimeMs) {
        virtualClockOriginMs = clock.millis() - virtualTimeMs / speedMultiplier;
    }

    private void restoreFromSnapshot(int index) {
        JsonNode payload = events.get(index).payload();
        List<ParticipantInfo> roster = new ArrayList<>();
        for (JsonNode node : payload.path("participants")) {
            roster.add(readParticipant(node));
        }
        SharedStateStore restored = stateStoreFactory.restore(payload.path("state"));

        participantsView.clear();
        cursorsView.clear();
        selectionsView.clear();
        camerasView.clear();
        annotationsView.clear();
        roster.forEach(this::addParticipant);
        restoreSceneNotes(index);

        if (reconstructedState != null) {
            reconstructedState.close();
        }
        reconstructedState = restored;
        listener.onStateRestored(index);
    }

    private void applyEvent(int index) {
        RoomEvent event = events.get(index);
        JsonNode payload = event.payload();
        String sessionId = payload.path("sessionId").asText(null);

        switch (event.type()) {
            case STATE_SNAPSHOT -> {
                restoreFromSnapshot(index);
                return;
            }
            case CRDT_UPDATE -> applyStoredUpdate(index, payload, sessionId);
            case CURSOR_UPDATE -> cursorsView.put(sessionId, readCursor(index, payload.path("cursor")));
            case SELECTION_UPDATE -> selectionsView.put(sessionId, readSelection(payload.path("selection")));
            case PARTICIPANT_JOINED -> addParticipant(readParticipant(payload));
            case PARTICIPANT_LEFT -> {
                participantsView.remove(sessionId);
                cursorsView.remove(sessionId);
                selectionsView.remove(sessionId);
                camerasView.remove(sessionId);
            }
            case CAMERA_UPDATE -> camerasView.put(sessionId, payload.path("camera"));
            case ANNOTATION_ADDED -> annotationsView.add(payload.path("annotation"));
            case CHAT_MESSAGE -> {
                // Chat is delivered through the listener only
            }
        }
        listener.onEventApplied(index, event);
    }

    /**
     * Snapshots carry neither cameras nor annotations, so rebuild both from the log before
     * {@code index}.
     */
    private void restoreSceneNotes(int index) {
        for (int i = 0; i < index; i++) {
            RoomEvent event = events.get(i);
            JsonNode payload = event.payload();
            String sessionId = payload.path("sessionId").asText(null);
            switch (event.type()) {
                case CAMERA_UPDATE -> {
                    if (participantsView.containsKey(sessionId)) {
                        camerasView.put(sessionId, payload.path("camera"));
                    }
                }
                case ANNOTATION_ADDED -> annotationsView.add(payload.path("annotation"));
                default -> {
                }
            }
        }
    }

    private void applyStoredUpdate(int index, JsonNode payload, String sessionId) {
        try {
            reconstructedState.applyUpdate(UpdateBytes.fromJson(payload.path("update")), sessionId);
        } catch (IllegalArgumentException | MessageException e) {
            throw new ReplayException(ErrorCode.RPL_001, "Unreadable update at event " + index, e);
        }
    }

    private void addParticipant(ParticipantInfo info) {
        participantsView.put(info.sessionId(), info);
        cursorsView.put(info.sessionId(), info.cursor());
        selectionsView.put(info.sessionId(), info.selection());
    }

    private ParticipantInfo readParticipant(JsonNode node) {
        try {
            ParticipantInfo info = objectMapper.treeToValue(node, ParticipantInfo.class);
            if (info == null || info.sessionId() == null) {
                throw new ReplayException(ErrorCode.RPL_001, "Participant entry without sessionId");
            }
            return info;
        } catch (JsonProcessingException e) {
            throw new ReplayException(ErrorCode.RPL_001, "Unreadable participant entry", e);
        }
    }

    private Vector3 readCursor(int index, JsonNode node) {
        if (!node.isObject()) {
            throw new ReplayException(ErrorCode.RPL_001, "Cursor missing at event " + index);
        }
        return new Vector3(node.path("x").asDouble(), node.path("y").asDouble(), node.path("z").asDouble());
    }

    private List<Integer> readSelection(JsonNode node) {
        List<Integer> selection = new ArrayList<>();
        for (JsonNode element : node) {
            selection.add(element.asInt());
        }
        return List.copyOf(selection);
    }

    private static void requireOrderedTimeline(Recording recording) {
        if (!Double.isFinite(recording.durationMs())) {
            throw new ReplayException(ErrorCode.RPL_002,
                    "Recording " + recording.recordingId() + " has no valid duration");
        }
        double previous = 0;
        List<RoomEvent> events = recording.events();
        for (int i = 0; i < events.size(); i++) {
            double time = events.get(i).relativeTimeMs();
            if (!Double.isFinite(time) || time < previous) {
                throw new ReplayException(ErrorCode.RPL_002,
                        "Event " + i + " of " + recording.recordingId() + " is out of order at " + time + " ms");
            }
            previous = time;
        }
    }

    private void requireLoaded() {
        if (recording == null) {
            throw new IllegalStateException("No recording loaded");
        }
    }
}
