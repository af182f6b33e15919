package com.molcollab.service;

import com.molcollab.codec.BinaryEventCodec;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.RecordingSummary;
import com.molcollab.exception.RecordingException;
import com.molcollab.exception.ReplayException;
import com.molcollab.model.Recording;
import com.molcollab.model.RoomEventType;
import com.molcollab.repository.RecordingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Recording control for live rooms plus access to finalized recordings and their binary form.
 */
@Service
public class RecordingService {

    private static final Logger logger = LoggerFactory.getLogger(RecordingService.class);

    private final RoomRegistry roomRegistry;
    private final RecordingRepository recordingRepository;
    private final BinaryEventCodec codec;

    public RecordingService(RoomRegistry roomRegistry, RecordingRepository recordingRepository,
                            BinaryEventCodec codec) {
        this.roomRegistry = roomRegistry;
        this.recordingRepository = recordingRepository;
        this.codec = codec;
    }

    /**
     * Start recording a room. Fails with {@code ROOM_001} for an unknown room and
     * {@code REC_001} when it is already recording.
     */
    public Mono<String> startRecording(String roomId) {
        return Mono.defer(() -> Mono.fromFuture(roomRegistry.getRoom(roomId).startRecording()));
    }

    /**
     * Stop recording a room.
     *
     * @return the finalized recording, or empty if the room was not recording
     */
    public Mono<Recording> stopRecording(String roomId) {
        return Mono.defer(() -> Mono.fromFuture(roomRegistry.getRoom(roomId).stopRecording()))
                .flatMap(Mono::justOrEmpty);
    }

    public Recording getRecording(String recordingId) {
        return recordingRepository.findById(recordingId)
                .orElseThrow(() -> new RecordingException(ErrorCode.REC_003, recordingId));
    }

    public List<RecordingSummary> listRecordings() {
        return recordingRepository.findAll().stream().map(RecordingSummary::of).toList();
    }

    public byte[] exportBinary(String recordingId) {
        return codec.encodeRecording(getRecording(recordingId));
    }

    /**
     * Decode a recording from its binary form and store it under a fresh id.
     *
     * @throws ReplayException {@code RPL_001} for undecodable bytes, {@code RPL_002} when the
     *                         recording does not open with a state snapshot
     */
    public Recording importBinary(byte[] data) {
        Recording recording = codec.decodeRecording(UUID.randomUUID().toString(), data);
        if (recording.events().isEmpty() || recording.events().get(0).type() != RoomEventType.STATE_SNAPSHOT) {
            throw new ReplayException(ErrorCode.RPL_002, "Imported recording must start with a state snapshot");
        }
        recordingRepository.save(recording);
        logger.info("Imported recording {} ({} events) for room {}",
                recording.recordingId(), recording.eventCount(), recording.roomId());
        return recording;
    }
}
