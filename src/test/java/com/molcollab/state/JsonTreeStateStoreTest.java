package com.molcollab.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.MessageException;
import com.molcollab.exception.ReplayException;
import com.molcollab.support.StateUpdates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonTreeStateStore Tests")
class JsonTreeStateStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JsonTreeStateStoreFactory factory;
    private SharedStateStore store;

    @BeforeEach
    void setUp() {
        factory = new JsonTreeStateStoreFactory(objectMapper);
        store = factory.create("aspirin");
    }

    @Test
    @DisplayName("New documents are seeded with the scene layout")
    void seededScene() {
        ObjectNode scene = store.snapshot();

        assertThat(scene.at("/molecule/id").asText()).isEqualTo("aspirin");
        assertThat(scene.at("/molecule/atoms").isArray()).isTrue();
        assertThat(scene.at("/camera/position/z").asInt()).isEqualTo(10);
        assertThat(scene.at("/camera/fov").asInt()).isEqualTo(45);
        assertThat(scene.at("/playback/isPlaying").asBoolean()).isFalse();
        assertThat(scene.at("/annotations").isArray()).isTrue();
    }

    @Test
    @DisplayName("set, push and remove follow dotted paths")
    void appliesOps() {
        store.applyUpdate(StateUpdates.set("camera.fov", 60), "s1");
        store.applyUpdate(StateUpdates.push("annotations", Map.of("text", "ring")), "s1");
        store.applyUpdate(StateUpdates.set("selections.alice.atoms", List.of(1, 2)), "s1");
        store.applyUpdate(StateUpdates.remove("playback"), "s1");

        ObjectNode scene = store.snapshot();
        assertThat(scene.at("/camera/fov").asInt()).isEqualTo(60);
        assertThat(scene.at("/annotations/0/text").asText()).isEqualTo("ring");
        assertThat(scene.at("/selections/alice/atoms/1").asInt()).isEqualTo(2);
        assertThat(scene.has("playback")).isFalse();
    }

    @Test
    @DisplayName("Later writes to the same path win")
    void lastWriterWins() {
        store.applyUpdate(StateUpdates.set("camera.fov", 50), "s1");
        store.applyUpdate(StateUpdates.set("camera.fov", 70), "s2");

        assertThat(store.snapshot().at("/camera/fov").asInt()).isEqualTo(70);
    }

    @Test
    @DisplayName("Listeners get canonical bytes and the origin")
    void notifiesListeners() {
        List<String> origins = new ArrayList<>();
        List<JsonNode> updates = new ArrayList<>();
        store.addUpdateListener((update, origin) -> {
            origins.add(origin);
            try {
                updates.add(objectMapper.readTree(update));
            } catch (IOException e) {
                throw new AssertionError(e);
            }
        });

        store.applyUpdate(StateUpdates.raw("{\"ops\":[{\"op\":\"set\",\"path\":\"camera.fov\",\"value\":30}],\"extra\":1}"), "s9");

        assertThat(origins).containsExactly("s9");
        assertThat(updates.get(0).has("extra")).isFalse();
        assertThat(updates.get(0).at("/ops/0/value").asInt()).isEqualTo(30);
    }

    @Test
    @DisplayName("Re-applying emitted bytes to a copy converges")
    void emittedBytesReproduceState() {
        List<byte[]> emitted = new ArrayList<>();
        store.addUpdateListener((update, origin) -> emitted.add(update));
        SharedStateStore replica = factory.restore(store.snapshot());

        store.applyUpdate(StateUpdates.set("molecule.name", "Aspirin"), "s1");
        store.applyUpdate(StateUpdates.push("molecule.atoms", Map.of("element", "C")), "s1");
        emitted.forEach(update -> replica.applyUpdate(update, "replay"));

        assertThat(replica.snapshot()).isEqualTo(store.snapshot());
    }

    @Test
    @DisplayName("An invalid op rejects the whole update")
    void atomicRejection() {
        ObjectNode before = store.snapshot();
        byte[] update = StateUpdates.raw(
                "{\"ops\":[{\"op\":\"set\",\"path\":\"camera.fov\",\"value\":5},{\"op\":\"explode\",\"path\":\"x\"}]}");

        assertThatThrownBy(() -> store.applyUpdate(update, "s1"))
                .isInstanceOf(MessageException.class)
                .satisfies(e -> assertThat(((MessageException) e).getErrorCode()).isEqualTo(ErrorCode.MSG_001));
        assertThat(store.snapshot()).isEqualTo(before);
    }

    @Test
    @DisplayName("Malformed update bytes are rejected")
    void malformedBytes() {
        assertThatThrownBy(() -> store.applyUpdate(StateUpdates.raw("not json"), "s1"))
                .isInstanceOf(MessageException.class);
        assertThatThrownBy(() -> store.applyUpdate(StateUpdates.raw("{\"ops\":{}}"), "s1"))
                .isInstanceOf(MessageException.class);
        assertThatThrownBy(() -> store.applyUpdate(StateUpdates.set("a..b", 1), "s1"))
                .isInstanceOf(MessageException.class);
        assertThatThrownBy(() -> store.applyUpdate(new byte[0], "s1"))
                .isInstanceOf(MessageException.class);
    }

    @Test
    @DisplayName("Snapshots are detached copies")
    void snapshotIsDetached() {
        ObjectNode snapshot = store.snapshot();
        snapshot.put("hijacked", true);

        assertThat(store.snapshot().has("hijacked")).isFalse();
    }

    @Test
    @DisplayName("Restoring requires an object tree")
    void restoreRejectsNonObject() {
        assertThatThrownBy(() -> factory.restore(objectMapper.createArrayNode()))
                .isInstanceOf(ReplayException.class);
    }
}
