package com.molcollab.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.config.CollaborationProperties;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.RoomException;
import com.molcollab.metrics.CollaborationMetrics;
import com.molcollab.model.Role;
import com.molcollab.model.Room;
import com.molcollab.model.RoomSummary;
import com.molcollab.model.Session;
import com.molcollab.repository.InMemoryRecordingRepository;
import com.molcollab.state.JsonTreeStateStoreFactory;
import com.molcollab.support.CapturingSink;
import com.molcollab.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RoomRegistry Tests")
class RoomRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(1_000);
    private final InMemoryRecordingRepository repository = new InMemoryRecordingRepository();
    private final List<Runnable> deferred = new ArrayList<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final CollaborationMetrics metrics = new CollaborationMetrics(meterRegistry);

    private RoomRegistry registry(Executor executor) {
        return new RoomRegistry(new JsonTreeStateStoreFactory(objectMapper), repository, clock, objectMapper,
                new CollaborationProperties(), executor, metrics);
    }

    private RoomRegistry direct() {
        return registry(Runnable::run);
    }

    private void runDeferred() {
        while (!deferred.isEmpty()) {
            deferred.remove(0).run();
        }
    }

    @Nested
    @DisplayName("Creating and joining")
    class Admission {

        @Test
        @DisplayName("The creator gets room-created before room-joined and owns the room")
        void createAndJoin() {
            RoomRegistry registry = direct();
            CapturingSink sink = new CapturingSink();

            Session session = registry.createAndJoin("alice", "caffeine", sink);

            assertThat(sink.types()).containsExactly("room-created", "room-joined");
            assertThat(sink.last("room-created").get("roomId")).isEqualTo(session.getRoomId());
            assertThat(session.getRole()).isEqualTo(Role.OWNER);
            assertThat(registry.getRoomCount()).isEqualTo(1);
            assertThat(registry.getTotalSessionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Joiners are viewers unless they own the room")
        void roles() {
            RoomRegistry registry = direct();
            Session owner = registry.createAndJoin("alice", "caffeine", new CapturingSink());

            Session viewer = registry.joinRoom(owner.getRoomId(), "bob", new CapturingSink());
            Session ownerAgain = registry.joinRoom(owner.getRoomId(), "alice", new CapturingSink());

            assertThat(viewer.getRole()).isEqualTo(Role.VIEWER);
            assertThat(ownerAgain.getRole()).isEqualTo(Role.OWNER);
            assertThat(registry.getRoom(owner.getRoomId()).getParticipantCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Joining an unknown room fails with ROOM_001")
        void unknownRoom() {
            RoomRegistry registry = direct();

            assertThatThrownBy(() -> registry.joinRoom("missing", "bob", new CapturingSink()))
                    .isInstanceOf(RoomException.class)
                    .extracting(e -> ((RoomException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ROOM_001);
            assertThat(registry.getTotalSessionCount()).isZero();
        }

        @Test
        @DisplayName("Rooms are listed with their subject and head count")
        void listRooms() {
            RoomRegistry registry = direct();
            Session a = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            registry.joinRoom(a.getRoomId(), "bob", new CapturingSink());
            registry.createRoom("carol", "aspirin");

            List<RoomSummary> rooms = registry.listRooms();

            assertThat(rooms).hasSize(2);
            assertThat(rooms).extracting(RoomSummary::roomId).isSorted();
            assertThat(rooms).filteredOn(r -> r.subjectId().equals("caffeine"))
                    .singleElement()
                    .extracting(RoomSummary::participantCount)
                    .isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Teardown")
    class Teardown {

        @Test
        @DisplayName("The last leave destroys the room and stores its running recording")
        void emptyRoomDestroyed() {
            RoomRegistry registry = direct();
            Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            Room room = registry.getRoom(alice.getRoomId());
            String recordingId = room.startRecording().join();

            clock.advance(500);
            registry.leave(alice);

            assertThat(registry.findRoom(alice.getRoomId())).isEmpty();
            assertThat(registry.getTotalSessionCount()).isZero();
            assertThat(repository.findById(recordingId)).hasValueSatisfying(recording -> {
                assertThat(recording.roomId()).isEqualTo(alice.getRoomId());
                assertThat(recording.durationMs()).isEqualTo(500.0);
            });
        }

        @Test
        @DisplayName("A room survives while other participants remain")
        void partialLeave() {
            RoomRegistry registry = direct();
            Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            Session bob = registry.joinRoom(alice.getRoomId(), "bob", new CapturingSink());

            registry.leave(alice);

            assertThat(registry.findRoom(bob.getRoomId())).isPresent();
            assertThat(registry.getRoom(bob.getRoomId()).getParticipantCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Leaving twice is harmless")
        void doubleLeave() {
            RoomRegistry registry = direct();
            Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            registry.joinRoom(alice.getRoomId(), "bob", new CapturingSink());

            registry.leave(alice);
            registry.leave(alice);

            assertThat(registry.getRoom(alice.getRoomId()).getParticipantCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("A join accepted before the last leave is processed keeps the room alive")
        void pendingJoinKeepsRoom() {
            RoomRegistry registry = registry(deferred::add);
            Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            runDeferred();

            registry.leave(alice);
            CapturingSink bobSink = new CapturingSink();
            registry.joinRoom(alice.getRoomId(), "bob", bobSink);
            runDeferred();

            assertThat(registry.findRoom(alice.getRoomId())).isPresent();
            assertThat(bobSink.types()).containsExactly("room-joined");
            assertThat(registry.getRoom(alice.getRoomId()).getParticipantCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Closing a room notifies participants and is idempotent")
        void closeRoom() {
            RoomRegistry registry = direct();
            CapturingSink sink = new CapturingSink();
            Session alice = registry.createAndJoin("alice", "caffeine", sink);

            registry.closeRoom(alice.getRoomId());
            registry.closeRoom(alice.getRoomId());

            assertThat(sink.ofType("room-closed")).hasSize(1);
            assertThat(registry.getRoomCount()).isZero();
            assertThat(registry.getTotalSessionCount()).isZero();
            assertThatThrownBy(() -> registry.getRoom(alice.getRoomId())).isInstanceOf(RoomException.class);
        }

        @Test
        @DisplayName("Shutdown closes every room and finalizes recordings")
        void shutdown() {
            RoomRegistry registry = direct();
            Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
            registry.getRoom(alice.getRoomId()).startRecording().join();
            registry.createRoom("bob", "aspirin");

            registry.shutdown();

            assertThat(registry.getRoomCount()).isZero();
            assertThat(repository.findAll()).hasSize(1);
        }
    }
}
