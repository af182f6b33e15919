package com.molcollab.controller;

import com.molcollab.dto.ReplayStatus;
import com.molcollab.model.ReplayStatistics;
import com.molcollab.service.ReplayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Replay sessions over stored recordings: open, inspect, seek and play back.
 */
@RestController
@RequestMapping("/api")
public class ReplayController {

    private static final Logger log = LoggerFactory.getLogger(ReplayController.class);

    private final ReplayService replayService;

    public ReplayController(ReplayService replayService) {
        this.replayService = replayService;
    }

    /**
     * POST /api/recordings/{recordingId}/replays
     */
    @PostMapping("/recordings/{recordingId}/replays")
    public Mono<ResponseEntity<ReplayStatus>> openReplay(@PathVariable String recordingId) {
        return Mono.fromSupplier(() -> replayService.open(recordingId))
                .map(replayId -> ResponseEntity.status(HttpStatus.CREATED).body(replayService.status(replayId)));
    }

    @GetMapping("/replays/{replayId}")
    public Mono<ReplayStatus> getReplay(@PathVariable String replayId) {
        return Mono.fromSupplier(() -> replayService.status(replayId));
    }

    /**
     * POST /api/replays/{replayId}/seek?t=1500
     */
    @PostMapping("/replays/{replayId}/seek")
    public Mono<ReplayStatus> seek(@PathVariable String replayId, @RequestParam("t") double targetMs) {
        log.debug("Replay {} seek to {} ms", replayId, targetMs);
        return Mono.fromSupplier(() -> replayService.seek(replayId, targetMs));
    }

    /**
     * POST /api/replays/{replayId}/seek-event?index=12
     */
    @PostMapping("/replays/{replayId}/seek-event")
    public Mono<ReplayStatus> seekToEvent(@PathVariable String replayId, @RequestParam int index) {
        return Mono.fromSupplier(() -> replayService.seekToEvent(replayId, index));
    }

    @PostMapping("/replays/{replayId}/play")
    public Mono<ReplayStatus> play(@PathVariable String replayId) {
        return Mono.fromSupplier(() -> replayService.play(replayId));
    }

    @PostMapping("/replays/{replayId}/pause")
    public Mono<ReplayStatus> pause(@PathVariable String replayId) {
        return Mono.fromSupplier(() -> replayService.pause(replayId));
    }

    @PostMapping("/replays/{replayId}/stop")
    public Mono<ReplayStatus> stop(@PathVariable String replayId) {
        return Mono.fromSupplier(() -> replayService.stop(replayId));
    }

    /**
     * POST /api/replays/{replayId}/speed?multiplier=2.0 (clamped to the configured range)
     */
    @PostMapping("/replays/{replayId}/speed")
    public Mono<ReplayStatus> setSpeed(@PathVariable String replayId, @RequestParam double multiplier) {
        return Mono.fromSupplier(() -> replayService.setSpeed(replayId, multiplier));
    }

    @GetMapping("/replays/{replayId}/statistics")
    public Mono<ReplayStatistics> statistics(@PathVariable String replayId) {
        return Mono.fromSupplier(() -> replayService.statistics(replayId));
    }

    @DeleteMapping("/replays/{replayId}")
    public Mono<ResponseEntity<Void>> closeReplay(@PathVariable String replayId) {
        return Mono.fromRunnable(() -> replayService.close(replayId))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
