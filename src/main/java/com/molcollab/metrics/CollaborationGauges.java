package com.molcollab.metrics;

import com.molcollab.service.ReplayService;
import com.molcollab.service.RoomRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Live room, session and replay counts, sampled on every scrape.
 */
@Component
public class CollaborationGauges implements MeterBinder {

    private final RoomRegistry roomRegistry;
    private final ReplayService replayService;

    public CollaborationGauges(RoomRegistry roomRegistry, ReplayService replayService) {
        this.roomRegistry = roomRegistry;
        this.replayService = replayService;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("molcollab.rooms.active", roomRegistry, RoomRegistry::getRoomCount)
                .description("Rooms with at least one participant or a pending join")
                .register(registry);
        Gauge.builder("molcollab.sessions.active", roomRegistry, RoomRegistry::getTotalSessionCount)
                .description("Joined WebSocket sessions across all rooms")
                .register(registry);
        Gauge.builder("molcollab.replays.open", replayService, ReplayService::getReplayCount)
                .description("Replay sessions currently open")
                .register(registry);
    }
}
