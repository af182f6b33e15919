package com.molcollab.dto;

import com.molcollab.model.Recording;

/**
 * Recording listing entry, without the event log.
 */
public record RecordingSummary(
        String recordingId,
        String roomId,
        String subjectId,
        double durationMs,
        int eventCount,
        int participantsAtClose
) {
    public static RecordingSummary of(Recording recording) {
        return new RecordingSummary(recording.recordingId(), recording.roomId(), recording.subjectId(),
                recording.durationMs(), recording.eventCount(), recording.participantsAtClose().size());
    }
}
