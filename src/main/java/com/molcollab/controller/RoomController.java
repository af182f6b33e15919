package com.molcollab.controller;

import com.molcollab.model.RoomSummary;
import com.molcollab.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST view of live rooms.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private static final Logger log = LoggerFactory.getLogger(RoomController.class);

    private final RoomRegistry roomRegistry;

    public RoomController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * GET /api/rooms
     */
    @GetMapping
    public Mono<List<RoomSummary>> listRooms() {
        return Mono.fromSupplier(roomRegistry::listRooms);
    }

    /**
     * Close a room, finalizing any running recording. Closing an unknown room succeeds.
     * DELETE /api/rooms/{roomId}
     */
    @DeleteMapping("/{roomId}")
    public Mono<ResponseEntity<Void>> closeRoom(@PathVariable String roomId) {
        return Mono.fromRunnable(() -> {
                    log.info("Close requested for room {}", roomId);
                    roomRegistry.closeRoom(roomId);
                })
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
