package com.molcollab.controller;

import com.molcollab.dto.RecordingSummary;
import com.molcollab.model.Recording;
import com.molcollab.service.RecordingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recording control for live rooms and access to finalized recordings.
 */
@RestController
@RequestMapping("/api")
public class RecordingController {

    private static final Logger log = LoggerFactory.getLogger(RecordingController.class);

    private final RecordingService recordingService;

    public RecordingController(RecordingService recordingService) {
        this.recordingService = recordingService;
    }

    /**
     * Start recording a room.
     * POST /api/rooms/{roomId}/recording/start
     */
    @PostMapping("/rooms/{roomId}/recording/start")
    public Mono<ResponseEntity<Map<String, Object>>> startRecording(@PathVariable String roomId) {
        log.info("Start recording requested for room {}", roomId);
        return recordingService.startRecording(roomId)
                .map(recordingId -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(Map.<String, Object>of("recordingId", recordingId)));
    }

    /**
     * Stop recording a room. A room that is not recording answers {@code success: false}.
     * POST /api/rooms/{roomId}/recording/stop
     */
    @PostMapping("/rooms/{roomId}/recording/stop")
    public Mono<Map<String, Object>> stopRecording(@PathVariable String roomId) {
        log.info("Stop recording requested for room {}", roomId);
        return recordingService.stopRecording(roomId)
                .map(recording -> {
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("success", true);
                    response.put("recordingId", recording.recordingId());
                    response.put("eventCount", recording.eventCount());
                    response.put("durationMs", recording.durationMs());
                    return response;
                })
                .defaultIfEmpty(Map.of("success", false));
    }

    @GetMapping("/recordings")
    public Mono<List<RecordingSummary>> listRecordings() {
        return Mono.fromSupplier(recordingService::listRecordings);
    }

    @GetMapping("/recordings/{recordingId}")
    public Mono<Recording> getRecording(@PathVariable String recordingId) {
        return Mono.fromSupplier(() -> recordingService.getRecording(recordingId));
    }

    /**
     * Binary export in the fixed event layout.
     * GET /api/recordings/{recordingId}/binary
     */
    @GetMapping(value = "/recordings/{recordingId}/binary", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<ResponseEntity<byte[]>> exportRecording(@PathVariable String recordingId) {
        return Mono.fromSupplier(() -> recordingService.exportBinary(recordingId))
                .map(bytes -> ResponseEntity.ok()
                        .header("Content-Disposition", "attachment; filename=\"" + recordingId + ".rec\"")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .body(bytes));
    }

    /**
     * Import a recording from its binary form.
     * POST /api/recordings/binary
     */
    @PostMapping(value = "/recordings/binary", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> importRecording(@RequestBody byte[] body) {
        return Mono.fromSupplier(() -> recordingService.importBinary(body))
                .map(recording -> {
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("recordingId", recording.recordingId());
                    response.put("roomId", recording.roomId());
                    response.put("eventCount", recording.eventCount());
                    return ResponseEntity.status(HttpStatus.CREATED).body(response);
                });
    }
}
