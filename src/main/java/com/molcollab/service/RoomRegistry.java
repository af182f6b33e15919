package com.molcollab.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.config.CollaborationProperties;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.ServerMessage;
import com.molcollab.exception.RoomException;
import com.molcollab.metrics.CollaborationMetrics;
import com.molcollab.model.Recording;
import com.molcollab.model.Role;
import com.molcollab.model.Room;
import com.molcollab.model.RoomSummary;
import com.molcollab.model.Session;
import com.molcollab.model.SessionSink;
import com.molcollab.repository.RecordingRepository;
import com.molcollab.state.SharedStateStoreFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Process-wide table of live rooms.
 * Creation, admission and teardown are serialized on this registry so a join can never land
 * in a room that is being destroyed. Per-room message processing is not serialized here.
 */
@Service
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    // Room ID -> Room
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    // Session ID -> Room ID
    private final Map<String, String> sessionToRoom = new ConcurrentHashMap<>();

    private final SharedStateStoreFactory stateStoreFactory;
    private final RecordingRepository recordingRepository;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Executor roomExecutor;
    private final CollaborationMetrics metrics;
    private final int checkpointEvery;

    public RoomRegistry(SharedStateStoreFactory stateStoreFactory,
                        RecordingRepository recordingRepository,
                        Clock clock,
                        ObjectMapper objectMapper,
                        CollaborationProperties properties,
                        @Qualifier("roomExecutor") Executor roomExecutor,
                        CollaborationMetrics metrics) {
        this.stateStoreFactory = stateStoreFactory;
        this.recordingRepository = recordingRepository;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.roomExecutor = roomExecutor;
        this.metrics = metrics;
        this.checkpointEvery = properties.getRecording().getCheckpointEvery();
    }

    /**
     * Create an empty room owned by the given user.
     *
     * @return the new room id
     */
    public synchronized String createRoom(String ownerUserId, String subjectId) {
        String roomId = UUID.randomUUID().toString();

        Recorder recorder = new Recorder(roomId, subjectId, clock, objectMapper, checkpointEvery);
        RoomMailbox mailbox = new RoomMailbox("room-" + roomId, roomExecutor);
        Room room = new Room(roomId, ownerUserId, subjectId, stateStoreFactory.create(subjectId),
                recorder, mailbox, clock, objectMapper, new RoomLifecycle());
        rooms.put(roomId, room);

        logger.info("Room created: {} for subject {} by {}", roomId, subjectId, ownerUserId);
        return roomId;
    }

    /**
     * Create a room and admit its creator. The creator is sent {@code room-created} before
     * the room's own {@code room-joined}.
     */
    public synchronized Session createAndJoin(String ownerUserId, String subjectId, SessionSink sink) {
        String roomId = createRoom(ownerUserId, subjectId);
        return admit(rooms.get(roomId), ownerUserId, sink, true);
    }

    /**
     * Admit a user into an existing room. The owner keeps the owner role on rejoin; everyone
     * else is a viewer.
     *
     * @throws RoomException {@code ROOM_001} when the room does not exist
     */
    public synchronized Session joinRoom(String roomId, String userId, SessionSink sink) {
        Room room = rooms.get(roomId);
        if (room == null) {
            logger.warn("Join rejected, room not found: {}", roomId);
            throw new RoomException(ErrorCode.ROOM_001, roomId);
        }
        return admit(room, userId, sink, false);
    }

    private Session admit(Room room, String userId, SessionSink sink, boolean announceCreation) {
        Role role = room.getOwnerId().equals(userId) ? Role.OWNER : Role.VIEWER;
        Session session = new Session(UUID.randomUUID().toString(), userId, room.getRoomId(), role,
                clock.instant(), sink);

        sessionToRoom.put(session.getSessionId(), room.getRoomId());
        room.reserveJoin();
        if (announceCreation) {
            session.send(ServerMessage.roomCreated(room.getRoomId(), session.getSessionId(), role));
        }
        room.addParticipant(session);
        return session;
    }

    /**
     * Detach a session from its room. A room left empty is destroyed by the room itself.
     */
    public void leave(Session session) {
        String roomId = sessionToRoom.remove(session.getSessionId());
        if (roomId == null) {
            return;
        }
        Room room = rooms.get(roomId);
        if (room != null) {
            room.removeParticipant(session.getSessionId());
        }
    }

    /**
     * Close a room regardless of who is in it, finalizing any running recording. Idempotent.
     */
    public synchronized void closeRoom(String roomId) {
        Room room = rooms.remove(roomId);
        if (room == null) {
            return;
        }
        sessionToRoom.values().removeIf(roomId::equals);
        room.close();
        logger.info("Room closed: {} (had {} participants)", roomId, room.getParticipantCount());
    }

    /**
     * Remove a room whose roster is empty and which has no join in flight.
     *
     * @return {@code true} if the room was removed
     */
    synchronized boolean destroyIfIdle(Room room) {
        if (rooms.get(room.getRoomId()) != room || !room.isIdle()) {
            return false;
        }
        rooms.remove(room.getRoomId());
        logger.info("Room destroyed after last participant left: {}", room.getRoomId());
        return true;
    }

    public List<RoomSummary> listRooms() {
        List<RoomSummary> summaries = new ArrayList<>();
        for (Room room : rooms.values()) {
            summaries.add(room.summary());
        }
        summaries.sort(Comparator.comparing(RoomSummary::roomId));
        return summaries;
    }

    public Optional<Room> findRoom(String roomId) {
        return roomId == null ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    /**
     * @throws RoomException {@code ROOM_001} when the room does not exist
     */
    public Room getRoom(String roomId) {
        return findRoom(roomId).orElseThrow(() -> new RoomException(ErrorCode.ROOM_001, roomId));
    }

    public int getRoomCount() {
        return rooms.size();
    }

    public int getTotalSessionCount() {
        return sessionToRoom.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (rooms.isEmpty()) {
            return;
        }
        logger.info("Closing {} rooms on shutdown", rooms.size());
        for (String roomId : new ArrayList<>(rooms.keySet())) {
            closeRoom(roomId);
        }
    }

    private final class RoomLifecycle implements Room.Lifecycle {

        @Override
        public boolean onEmpty(Room room) {
            return destroyIfIdle(room);
        }

        @Override
        public void onRecordingStarted(String recordingId) {
            metrics.recordingStarted();
        }

        @Override
        public void onRecordingFinalized(Recording recording) {
            recordingRepository.save(recording);
            metrics.recordingFinalized();
        }
    }
}
