package com.molcollab.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.config.CollaborationProperties;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.model.Room;
import com.molcollab.model.Session;
import com.molcollab.repository.InMemoryRecordingRepository;
import com.molcollab.service.ReplayService;
import com.molcollab.service.RoomRegistry;
import com.molcollab.state.JsonTreeStateStoreFactory;
import com.molcollab.support.CapturingSink;
import com.molcollab.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Collaboration metrics Tests")
class CollaborationMetricsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final CollaborationMetrics metrics = new CollaborationMetrics(meterRegistry);

    @Mock
    private ReplayService replayService;

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry(new JsonTreeStateStoreFactory(objectMapper), new InMemoryRecordingRepository(),
                new MutableClock(1_000), objectMapper, new CollaborationProperties(), Runnable::run, metrics);
    }

    @Test
    @DisplayName("Gauges follow live rooms, sessions and open replays")
    void gauges() {
        when(replayService.getReplayCount()).thenReturn(2);
        new CollaborationGauges(registry, replayService).bindTo(meterRegistry);

        Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
        registry.joinRoom(alice.getRoomId(), "bob", new CapturingSink());
        registry.createAndJoin("carol", "benzene", new CapturingSink());

        assertThat(meterRegistry.get("molcollab.rooms.active").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.get("molcollab.sessions.active").gauge().value()).isEqualTo(3.0);
        assertThat(meterRegistry.get("molcollab.replays.open").gauge().value()).isEqualTo(2.0);

        registry.leave(alice);
        assertThat(meterRegistry.get("molcollab.sessions.active").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Started and finalized recordings are counted, including those closed with their room")
    void recordingCounters() {
        Session alice = registry.createAndJoin("alice", "caffeine", new CapturingSink());
        Room room = registry.getRoom(alice.getRoomId());

        room.startRecording().join();
        room.stopRecording().join();
        room.startRecording().join();
        registry.leave(alice);

        assertThat(meterRegistry.get("molcollab.recordings.started").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("molcollab.recordings.finalized").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Rejections are counted per error code")
    void rejectedMessages() {
        metrics.messageRejected(ErrorCode.MSG_002);
        metrics.messageRejected(ErrorCode.MSG_002);
        metrics.messageRejected(ErrorCode.VAL_001);

        assertThat(meterRegistry.get("molcollab.messages.rejected").tag("code", "MSG_002").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("molcollab.messages.rejected").tag("code", "VAL_001").counter().count())
                .isEqualTo(1.0);
    }
}
