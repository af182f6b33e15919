package com.molcollab.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.dto.ClientMessage;
import com.molcollab.dto.ClientMessageType;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.HandshakeAction;
import com.molcollab.exception.MessageException;
import com.molcollab.model.Vector3;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ClientMessageParser Tests")
class ClientMessageParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ClientMessageParser parser = new ClientMessageParser(objectMapper);

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    private static ErrorCode codeOf(Throwable e) {
        return ((MessageException) e).getErrorCode();
    }

    @Nested
    @DisplayName("Frame parsing")
    class Frames {

        @Test
        @DisplayName("Handshake fields are read, with moleculeId accepted for subjectId")
        void handshake() {
            ClientMessage message = parser.parse(
                    "{\"type\":\"handshake\",\"action\":\"create-room\",\"userId\":\"alice\",\"moleculeId\":\"caffeine\",\"token\":\"t\"}");

            assertThat(message.type()).isEqualTo(ClientMessageType.HANDSHAKE);
            assertThat(message.action()).isEqualTo(HandshakeAction.CREATE_ROOM);
            assertThat(message.userId()).isEqualTo("alice");
            assertThat(message.subjectId()).isEqualTo("caffeine");
            assertThat(message.token()).isEqualTo("t");
        }

        @Test
        @DisplayName("Non-handshake frames carry their payload")
        void payload() {
            ClientMessage message = parser.parse("{\"type\":\"cursor-update\",\"payload\":{\"x\":1,\"y\":2,\"z\":3}}");

            assertThat(message.type()).isEqualTo(ClientMessageType.CURSOR_UPDATE);
            assertThat(message.payload().path("y").asInt()).isEqualTo(2);
        }

        @ParameterizedTest
        @ValueSource(strings = {"{not json", "[1,2]", "\"text\"", "{\"payload\":{}}",
                "{\"type\":\"handshake\",\"action\":\"teleport\"}"})
        @DisplayName("Malformed frames fail with MSG_001")
        void malformed(String frame) {
            assertThatThrownBy(() -> parser.parse(frame))
                    .isInstanceOf(MessageException.class)
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MSG_001));
        }

        @Test
        @DisplayName("Unknown types fail with MSG_002")
        void unknownType() {
            assertThatThrownBy(() -> parser.parse("{\"type\":\"self-destruct\"}"))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MSG_002));
        }
    }

    @Nested
    @DisplayName("Payload readers")
    class Payloads {

        @Test
        @DisplayName("Cursor may be bare or wrapped")
        void cursor() throws Exception {
            assertThat(parser.readCursor(json("{\"x\":1,\"y\":2,\"z\":0}"))).isEqualTo(new Vector3(1, 2, 0));
            assertThat(parser.readCursor(json("{\"cursor\":{\"x\":1.5,\"y\":0,\"z\":-2}}")))
                    .isEqualTo(new Vector3(1.5, 0, -2));
            assertThatThrownBy(() -> parser.readCursor(json("{\"x\":\"a\",\"y\":0,\"z\":0}")))
                    .isInstanceOf(MessageException.class);
        }

        @Test
        @DisplayName("Selection accepts an array of integers only")
        void selection() throws Exception {
            assertThat(parser.readSelection(json("[3,1,2]"))).containsExactly(3, 1, 2);
            assertThat(parser.readSelection(json("{\"selection\":[]}"))).isEmpty();
            assertThatThrownBy(() -> parser.readSelection(json("[1.5]"))).isInstanceOf(MessageException.class);
            assertThatThrownBy(() -> parser.readSelection(json("{\"selection\":7}"))).isInstanceOf(MessageException.class);
        }

        @Test
        @DisplayName("Update bytes may be a byte array or base64, bare or wrapped")
        void update() throws Exception {
            byte[] bytes = "{\"ops\":[]}".getBytes(StandardCharsets.UTF_8);
            String base64 = Base64.getEncoder().encodeToString(bytes);

            assertThat(parser.readUpdate(json("\"" + base64 + "\""))).isEqualTo(bytes);
            assertThat(parser.readUpdate(json("{\"update\":\"" + base64 + "\"}"))).isEqualTo(bytes);
            assertThat(parser.readUpdate(json("[0,255,16]"))).containsExactly(0, -1, 16);
            assertThatThrownBy(() -> parser.readUpdate(json("[256]")))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MSG_001));
        }

        @Test
        @DisplayName("Chat accepts text or message fields and a plain string")
        void chat() throws Exception {
            assertThat(parser.readChat(json("{\"username\":\"Alice\",\"text\":\"hi\"}")))
                    .isEqualTo(new ClientMessageParser.ChatLine("Alice", "hi"));
            assertThat(parser.readChat(json("{\"message\":\"hello\"}")).text()).isEqualTo("hello");
            assertThat(parser.readChat(json("\"plain\""))).isEqualTo(new ClientMessageParser.ChatLine(null, "plain"));
            assertThatThrownBy(() -> parser.readChat(json("42"))).isInstanceOf(MessageException.class);
        }

        @Test
        @DisplayName("Objects are read wrapped or bare and copied")
        void object() throws Exception {
            JsonNode payload = json("{\"camera\":{\"fov\":30}}");

            JsonNode camera = parser.readObject(payload, "camera");

            assertThat(camera.path("fov").asInt()).isEqualTo(30);
            assertThat(camera).isNotSameAs(payload.get("camera"));
            assertThat(parser.readObject(json("{\"text\":\"ring\"}"), "annotation").path("text").asText())
                    .isEqualTo("ring");
            assertThatThrownBy(() -> parser.readObject(json("{\"camera\":1}"), "camera"))
                    .isInstanceOf(MessageException.class);
        }
    }
}
