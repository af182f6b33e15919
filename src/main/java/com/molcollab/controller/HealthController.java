package com.molcollab.controller;

import com.molcollab.service.ReplayService;
import com.molcollab.service.RoomRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final RoomRegistry roomRegistry;
    private final ReplayService replayService;
    private final Clock clock;

    public HealthController(RoomRegistry roomRegistry, ReplayService replayService, Clock clock) {
        this.roomRegistry = roomRegistry;
        this.replayService = replayService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("status", "healthy");
            status.put("rooms", roomRegistry.getRoomCount());
            status.put("sessions", roomRegistry.getTotalSessionCount());
            status.put("replays", replayService.getReplayCount());
            status.put("timestamp", clock.instant().toString());
            return status;
        });
    }
}
