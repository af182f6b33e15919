package com.molcollab.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.molcollab.model.ParticipantInfo;
import com.molcollab.model.PlaybackState;
import com.molcollab.model.Vector3;
import com.molcollab.service.ReplayEngine;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of a replay session returned by the replay endpoints.
 */
public record ReplayStatus(
        String replayId,
        String recordingId,
        PlaybackState playbackState,
        double currentTimeMs,
        double durationMs,
        double progress,
        int cursorIndex,
        int eventCount,
        double speedMultiplier,
        JsonNode state,
        List<ParticipantInfo> participants,
        Map<String, Vector3> cursors,
        Map<String, List<Integer>> selections,
        Map<String, JsonNode> cameras,
        List<JsonNode> annotations
) {

    public static ReplayStatus of(String replayId, ReplayEngine engine) {
        // Read under the engine's lock so the fields describe one instant
        synchronized (engine) {
            return new ReplayStatus(
                    replayId,
                    engine.getRecording().recordingId(),
                    engine.getPlaybackState(),
                    engine.getCurrentTimeMs(),
                    engine.getDurationMs(),
                    engine.getProgress(),
                    engine.getCursorIndex(),
                    engine.getEventCount(),
                    engine.getSpeedMultiplier(),
                    engine.snapshot(),
                    engine.getParticipants(),
                    engine.getCursors(),
                    engine.getSelections(),
                    engine.getCameras(),
                    engine.getAnnotations());
        }
    }
}
