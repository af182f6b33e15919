package com.molcollab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary figures for a loaded recording.
 *
 * @param eventsByType    event count per wire type name, in type order
 * @param participantCount distinct sessions seen in the recording
 * @param eventsPerSecond  total events over the recording duration, 0 for an instantaneous one
 */
public record ReplayStatistics(
        String recordingId,
        double durationMs,
        int eventCount,
        Map<String, Integer> eventsByType,
        int participantCount,
        int snapshotCount,
        double eventsPerSecond
) {
    public ReplayStatistics {
        eventsByType = Collections.unmodifiableMap(new LinkedHashMap<>(eventsByType));
    }
}
