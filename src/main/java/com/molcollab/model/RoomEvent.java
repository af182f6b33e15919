package com.molcollab.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One immutable, timestamped entry of a recording's event log.
 *
 * @param absoluteTimestamp wall-clock epoch millis at which the event was recorded
 * @param relativeTimeMs    offset from the recording start
 * @param type              event kind
 * @param originUserId      user whose action produced the event
 * @param payload           type-specific JSON value
 */
public record RoomEvent(
        double absoluteTimestamp,
        double relativeTimeMs,
        RoomEventType type,
        String originUserId,
        JsonNode payload
) {
    public RoomEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (originUserId == null) originUserId = "";
        payload = payload.deepCopy();
    }

    /**
     * Payload copy; the stored tree is never handed out.
     */
    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }
}
