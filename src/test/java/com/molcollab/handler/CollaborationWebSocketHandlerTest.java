package com.molcollab.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.config.CollaborationProperties;
import com.molcollab.handler.CollaborationWebSocketHandler.Connection;
import com.molcollab.metrics.CollaborationMetrics;
import com.molcollab.repository.InMemoryRecordingRepository;
import com.molcollab.security.PermissiveHandshakeAuthenticator;
import com.molcollab.service.RoomRegistry;
import com.molcollab.state.JsonTreeStateStoreFactory;
import com.molcollab.support.MutableClock;
import com.molcollab.validation.InputValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;
import reactor.core.publisher.Sinks;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CollaborationWebSocketHandler Tests")
class CollaborationWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final CollaborationMetrics metrics = new CollaborationMetrics(meterRegistry);
    private RoomRegistry registry;
    private CollaborationWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        CollaborationProperties properties = new CollaborationProperties();
        registry = new RoomRegistry(new JsonTreeStateStoreFactory(objectMapper), new InMemoryRecordingRepository(),
                new MutableClock(1_000), objectMapper, properties, Runnable::run, metrics);
        handler = new CollaborationWebSocketHandler(registry, new PermissiveHandshakeAuthenticator(),
                new ClientMessageParser(objectMapper), new InputValidator(properties), objectMapper, metrics);
    }

    /**
     * A connection plus everything written to it.
     */
    private final class Client {
        final Connection connection;
        final List<JsonNode> frames = new CopyOnWriteArrayList<>();
        boolean completed;

        Client(String id) {
            Sinks.Many<String> outbound = Sinks.many().replay().all();
            outbound.asFlux()
                    .doOnComplete(() -> completed = true)
                    .subscribe(text -> frames.add(read(text)));
            connection = handler.new Connection(id, outbound);
        }

        void send(String frame) {
            handler.handleText(connection, frame);
        }

        List<String> types() {
            return frames.stream().map(f -> f.path("type").asText()).collect(Collectors.toList());
        }

        JsonNode last(String type) {
            List<JsonNode> matching = frames.stream()
                    .filter(f -> f.path("type").asText().equals(type))
                    .collect(Collectors.toList());
            assertThat(matching).as("%s frames among %s", type, types()).isNotEmpty();
            return matching.get(matching.size() - 1);
        }

        void clear() {
            frames.clear();
        }
    }

    private JsonNode read(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String create(String userId) {
        return "{\"type\":\"handshake\",\"action\":\"create-room\",\"userId\":\"" + userId
                + "\",\"subjectId\":\"caffeine\",\"token\":\"t\"}";
    }

    private static String join(String userId, String roomId) {
        return "{\"type\":\"handshake\",\"action\":\"join-room\",\"userId\":\"" + userId
                + "\",\"roomId\":\"" + roomId + "\",\"token\":\"t\"}";
    }

    @Nested
    @DisplayName("Handshake")
    class Handshake {

        @Test
        @DisplayName("create-room answers room-created then room-joined")
        void createRoom() {
            Client alice = new Client("c1");

            alice.send(create("alice"));

            assertThat(alice.types()).containsExactly("room-created", "room-joined");
            JsonNode joined = alice.last("room-joined");
            assertThat(joined.path("role").asText()).isEqualTo("owner");
            assertThat(joined.path("state").at("/molecule/id").asText()).isEqualTo("caffeine");
            assertThat(alice.connection.getSession()).isNotNull();
            assertThat(registry.getRoomCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("join-room admits a viewer and announces them")
        void joinRoom() {
            Client alice = new Client("c1");
            alice.send(create("alice"));
            String roomId = alice.last("room-created").path("roomId").asText();
            Client bob = new Client("c2");

            bob.send(join("bob", roomId));

            assertThat(bob.last("room-joined").path("role").asText()).isEqualTo("viewer");
            assertThat(bob.last("room-joined").path("participants")).hasSize(2);
            assertThat(alice.last("participant-joined").at("/participant/userId").asText()).isEqualTo("bob");
        }

        @Test
        @DisplayName("Joining an unknown room is a handshake error that keeps the socket open")
        void unknownRoom() {
            Client bob = new Client("c2");

            bob.send(join("bob", "no-such-room"));

            assertThat(bob.types()).containsExactly("handshake-error");
            assertThat(bob.connection.getSession()).isNull();
            assertThat(bob.completed).isFalse();
        }

        @Test
        @DisplayName("Failed authentication closes the socket with a policy violation")
        void authFailure() {
            Client eve = new Client("c3");

            eve.send("{\"type\":\"handshake\",\"action\":\"create-room\",\"userId\":\"eve\",\"subjectId\":\"x\"}");

            assertThat(eve.types()).containsExactly("handshake-error");
            assertThat(eve.completed).isTrue();
            assertThat(eve.connection.getCloseStatus()).isEqualTo(CloseStatus.POLICY_VIOLATION);
            assertThat(registry.getRoomCount()).isZero();
        }

        @Test
        @DisplayName("Oversized user ids are refused before any room is touched")
        void userIdTooLong() {
            Client client = new Client("c4");

            client.send(create("u".repeat(40)));

            assertThat(client.types()).containsExactly("handshake-error");
            assertThat(registry.getRoomCount()).isZero();
        }

        @Test
        @DisplayName("list-rooms answers without joining")
        void listRooms() {
            new Client("c1").send(create("alice"));
            Client browser = new Client("c2");

            browser.send("{\"type\":\"handshake\",\"action\":\"list-rooms\",\"token\":\"t\",\"userId\":\"b\"}");

            assertThat(browser.last("room-list").path("rooms")).hasSize(1);
            assertThat(browser.connection.getSession()).isNull();
        }

        @Test
        @DisplayName("A second handshake on a joined connection is rejected")
        void secondHandshake() {
            Client alice = new Client("c1");
            alice.send(create("alice"));
            alice.clear();

            alice.send(create("alice"));

            assertThat(alice.last("error").path("code").asText()).isEqualTo("MSG_001");
            assertThat(registry.getRoomCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Messages")
    class Messages {

        private Client alice;
        private Client bob;

        @BeforeEach
        void joinBoth() {
            alice = new Client("c1");
            alice.send(create("alice"));
            bob = new Client("c2");
            bob.send(join("bob", alice.last("room-created").path("roomId").asText()));
            alice.clear();
            bob.clear();
        }

        @Test
        @DisplayName("Messages before the handshake fail with MSG_003")
        void beforeHandshake() {
            Client stranger = new Client("c9");

            stranger.send("{\"type\":\"cursor-update\",\"payload\":{\"x\":0,\"y\":0,\"z\":0}}");

            assertThat(stranger.last("error").path("code").asText()).isEqualTo("MSG_003");
            assertThat(meterRegistry.get("molcollab.messages.rejected").tag("code", "MSG_003").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Cursor updates reach the other participant only")
        void cursor() {
            alice.send("{\"type\":\"cursor-update\",\"payload\":{\"x\":1,\"y\":2,\"z\":0}}");

            JsonNode update = bob.last("cursor-update");
            assertThat(update.path("userId").asText()).isEqualTo("alice");
            assertThat(update.at("/cursor/x").asDouble()).isEqualTo(1.0);
            assertThat(update.at("/cursor/y").asDouble()).isEqualTo(2.0);
            assertThat(alice.types()).doesNotContain("cursor-update");
        }

        @Test
        @DisplayName("State updates fan out as byte arrays")
        void stateUpdate() {
            alice.send("{\"type\":\"state-update\",\"payload\":{\"update\":"
                    + byteArray("{\"ops\":[{\"op\":\"set\",\"path\":\"camera.fov\",\"value\":60}]}") + "}}");

            JsonNode update = bob.last("crdt-update");
            assertThat(update.path("origin").asText()).isEqualTo("alice");
            assertThat(update.path("update").isArray()).isTrue();
            assertThat(alice.types()).isEmpty();
        }

        @Test
        @DisplayName("Chat is echoed to the sender and validated")
        void chat() {
            alice.send("{\"type\":\"chat-message\",\"payload\":{\"username\":\"Alice\",\"text\":\"hello\"}}");
            bob.send("{\"type\":\"chat-message\",\"payload\":{\"text\":\"   \"}}");

            assertThat(alice.last("chat-message").path("message").asText()).isEqualTo("hello");
            assertThat(bob.last("chat-message").path("username").asText()).isEqualTo("Alice");
            assertThat(bob.last("error").path("code").asText()).isEqualTo("VAL_002");
        }

        @Test
        @DisplayName("Unknown and malformed frames are reported to the sender")
        void badFrames() {
            alice.send("{\"type\":\"teleport\"}");
            alice.send("{broken");
            alice.send("{\"type\":\"selection-update\",\"payload\":[-1]}");

            assertThat(alice.frames).extracting(f -> f.path("code").asText())
                    .containsExactly("MSG_002", "MSG_001", "VAL_001");
            assertThat(bob.frames).isEmpty();
        }

        @Test
        @DisplayName("A dropped connection leaves the room")
        void disconnect() {
            handler.disconnect(bob.connection);

            assertThat(alice.last("participant-left").path("userId").asText()).isEqualTo("bob");
            assertThat(bob.completed).isTrue();
            assertThat(registry.getTotalSessionCount()).isEqualTo(1);

            handler.disconnect(alice.connection);
            assertThat(registry.getRoomCount()).isZero();
        }
    }

    private static String byteArray(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append(Byte.toUnsignedInt(bytes[i]));
        }
        return json.append(']').toString();
    }
}
