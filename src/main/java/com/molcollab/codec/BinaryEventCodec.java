package com.molcollab.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.exception.RecordingException;
import com.molcollab.exception.ReplayException;
import com.molcollab.model.Recording;
import com.molcollab.model.RoomEvent;
import com.molcollab.model.RoomEventType;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-layout binary form of recorded events and recordings. All fields little-endian.
 *
 * <pre>
 * event:     float64 absoluteTimestamp | float64 relativeTimeMs | uint8 typeIndex
 *            | 36 bytes originUserId (UTF-8, NUL padded) | uint32 payloadLength | payload (UTF-8 JSON)
 * recording: uint32 eventCount | float64 durationMs | event*
 * </pre>
 *
 * User ids longer than 36 UTF-8 bytes are rejected on encode rather than truncated.
 * <p>
 * Payloads survive a round trip as JSON values, not as node classes: a number is read back
 * as the narrowest node that holds it, so a {@code LongNode} of 5 decodes as an
 * {@code IntNode}. Compare decoded payloads numerically where that matters.
 */
@Component
public class BinaryEventCodec {

    public static final int USER_ID_BYTES = 36;
    public static final int EVENT_HEADER_BYTES = 8 + 8 + 1 + USER_ID_BYTES + 4;
    public static final int RECORDING_HEADER_BYTES = 4 + 8;

    private final ObjectMapper objectMapper;

    public BinaryEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(RoomEvent event) {
        byte[] userId = userIdBytes(event.originUserId());
        byte[] payload = payloadBytes(event.payload());

        ByteBuffer buffer = ByteBuffer.allocate(EVENT_HEADER_BYTES + payload.length)
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putDouble(event.absoluteTimestamp());
        buffer.putDouble(event.relativeTimeMs());
        buffer.put((byte) event.type().index());
        buffer.put(userId);
        buffer.position(buffer.position() + (USER_ID_BYTES - userId.length));
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    public RoomEvent decode(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        RoomEvent event = decode(buffer);
        if (buffer.hasRemaining()) {
            throw new ReplayException(ErrorCode.RPL_001, buffer.remaining() + " trailing bytes after event");
        }
        return event;
    }

    /**
     * Decode one event starting at the buffer's position and advance past it.
     * The buffer must be little-endian.
     */
    public RoomEvent decode(ByteBuffer buffer) {
        if (buffer.remaining() < EVENT_HEADER_BYTES) {
            throw new ReplayException(ErrorCode.RPL_001,
                    "Event header needs " + EVENT_HEADER_BYTES + " bytes, " + buffer.remaining() + " available");
        }

        double absoluteTimestamp = buffer.getDouble();
        double relativeTimeMs = buffer.getDouble();

        int typeIndex = Byte.toUnsignedInt(buffer.get());
        RoomEventType type = RoomEventType.fromIndex(typeIndex);
        if (type == null) {
            throw new ReplayException(ErrorCode.RPL_001, "Event type index out of range: " + typeIndex);
        }

        byte[] userIdField = new byte[USER_ID_BYTES];
        buffer.get(userIdField);
        int userIdLength = USER_ID_BYTES;
        while (userIdLength > 0 && userIdField[userIdLength - 1] == 0) {
            userIdLength--;
        }
        String originUserId = new String(userIdField, 0, userIdLength, StandardCharsets.UTF_8);

        long payloadLength = Integer.toUnsignedLong(buffer.getInt());
        if (payloadLength > buffer.remaining()) {
            throw new ReplayException(ErrorCode.RPL_001,
                    "Payload length " + payloadLength + " exceeds remaining " + buffer.remaining() + " bytes");
        }

        byte[] payloadBytes = new byte[(int) payloadLength];
        buffer.get(payloadBytes);
        JsonNode payload;
        try {
            payload = objectMapper.readTree(payloadBytes);
        } catch (IOException e) {
            throw new ReplayException(ErrorCode.RPL_001, "Payload is not valid JSON", e);
        }
        if (payload == null || payload.isMissingNode()) {
            throw new ReplayException(ErrorCode.RPL_001, "Empty payload");
        }

        return new RoomEvent(absoluteTimestamp, relativeTimeMs, type, originUserId, payload);
    }

    public byte[] encodeRecording(Recording recording) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        ByteBuffer header = ByteBuffer.allocate(RECORDING_HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(recording.events().size());
        header.putDouble(recording.durationMs());
        out.writeBytes(header.array());

        for (RoomEvent event : recording.events()) {
            out.writeBytes(encode(event));
        }
        return out.toByteArray();
    }

    /**
     * Decode a recording body. Room and subject ids are taken from the leading
     * {@code state-snapshot} event when present; the roster at close is not part of the format.
     * The duration and every event time must be finite and the relative times must not go
     * backwards, since seeking relies on their order.
     */
    public Recording decodeRecording(String recordingId, byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        long eventCount;
        double durationMs;
        try {
            eventCount = Integer.toUnsignedLong(buffer.getInt());
            durationMs = buffer.getDouble();
        } catch (BufferUnderflowException e) {
            throw new ReplayException(ErrorCode.RPL_001, "Recording header needs " + RECORDING_HEADER_BYTES + " bytes");
        }

        if (!Double.isFinite(durationMs) || durationMs < 0) {
            throw new ReplayException(ErrorCode.RPL_001, "Recording duration is not a valid time: " + durationMs);
        }

        List<RoomEvent> events = new ArrayList<>();
        double previousTimeMs = 0;
        for (long i = 0; i < eventCount; i++) {
            RoomEvent event = decode(buffer);
            double relativeTimeMs = event.relativeTimeMs();
            if (!Double.isFinite(event.absoluteTimestamp()) || !Double.isFinite(relativeTimeMs)) {
                throw new ReplayException(ErrorCode.RPL_001, "Event " + i + " has a non-finite timestamp");
            }
            if (relativeTimeMs < previousTimeMs) {
                throw new ReplayException(ErrorCode.RPL_001,
                        "Event " + i + " at " + relativeTimeMs + " ms precedes the previous event at " + previousTimeMs + " ms");
            }
            previousTimeMs = relativeTimeMs;
            events.add(event);
        }
        if (buffer.hasRemaining()) {
            throw new ReplayException(ErrorCode.RPL_001, buffer.remaining() + " trailing bytes after last event");
        }

        String roomId = null;
        String subjectId = null;
        if (!events.isEmpty() && events.get(0).type() == RoomEventType.STATE_SNAPSHOT) {
            JsonNode anchor = events.get(0).payload();
            roomId = anchor.path("roomId").asText(null);
            subjectId = anchor.path("subjectId").asText(null);
        }
        return new Recording(recordingId, roomId, subjectId, durationMs, events, List.of());
    }

    private byte[] userIdBytes(String userId) {
        byte[] bytes = userId.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > USER_ID_BYTES) {
            throw new RecordingException(ErrorCode.REC_004,
                    "'" + userId + "' is " + bytes.length + " bytes");
        }
        return bytes;
    }

    private byte[] payloadBytes(JsonNode payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize event payload", e);
        }
    }
}
