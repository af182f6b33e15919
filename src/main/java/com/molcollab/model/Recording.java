package com.molcollab.model;

import java.util.List;
import java.util.Objects;

/**
 * Finalized, immutable output of a room's recording window.
 */
public record Recording(
        String recordingId,
        String roomId,
        String subjectId,
        double durationMs,
        List<RoomEvent> events,
        List<ParticipantInfo> participantsAtClose
) {
    public Recording {
        Objects.requireNonNull(recordingId, "recordingId");
        events = List.copyOf(events);
        participantsAtClose = participantsAtClose == null ? List.of() : List.copyOf(participantsAtClose);
    }

    public int eventCount() {
        return events.size();
    }
}
