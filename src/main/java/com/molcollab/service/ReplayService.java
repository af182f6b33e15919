package com.molcollab.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.molcollab.config.CollaborationProperties;
import com.molcollab.dto.ErrorResponse.ErrorCode;
import com.molcollab.dto.ReplayStatus;
import com.molcollab.exception.ReplayException;
import com.molcollab.model.PlaybackState;
import com.molcollab.model.Recording;
import com.molcollab.model.ReplayStatistics;
import com.molcollab.state.SharedStateStoreFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the replay sessions opened over stored recordings and drives their playback.
 * Each replay is independent: a failure in one pauses that replay only.
 */
@Service
public class ReplayService {

    private static final Logger logger = LoggerFactory.getLogger(ReplayService.class);

    private final Map<String, ReplayEngine> replays = new ConcurrentHashMap<>();

    private final RecordingService recordingService;
    private final SharedStateStoreFactory stateStoreFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CollaborationProperties.ReplaySettings settings;

    public ReplayService(RecordingService recordingService,
                         SharedStateStoreFactory stateStoreFactory,
                         ObjectMapper objectMapper,
                         Clock clock,
                         CollaborationProperties properties) {
        this.recordingService = recordingService;
        this.stateStoreFactory = stateStoreFactory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getReplay();
    }

    /**
     * Open a replay over a stored recording, positioned at its start.
     *
     * @return the replay id
     */
    public String open(String recordingId) {
        Recording recording = recordingService.getRecording(recordingId);

        ReplayEngine engine = new ReplayEngine(stateStoreFactory, objectMapper, clock,
                settings.getMinSpeed(), settings.getMaxSpeed());
        engine.load(recording);

        String replayId = UUID.randomUUID().toString();
        engine.setListener(new ReplayListener() {
            @Override
            public void onPlaybackComplete() {
                logger.info("Replay {} reached the end of recording {}", replayId, recordingId);
            }
        });
        replays.put(replayId, engine);
        logger.info("Replay {} opened for recording {}", replayId, recordingId);
        return replayId;
    }

    public ReplayEngine getEngine(String replayId) {
        ReplayEngine engine = replays.get(replayId);
        if (engine == null) {
            throw new ReplayException(ErrorCode.RPL_003, replayId);
        }
        return engine;
    }

    public ReplayStatus status(String replayId) {
        return ReplayStatus.of(replayId, getEngine(replayId));
    }

    public ReplayStatus seek(String replayId, double targetMs) {
        getEngine(replayId).seek(targetMs);
        return status(replayId);
    }

    public ReplayStatus seekToEvent(String replayId, int index) {
        getEngine(replayId).seekToEvent(index);
        return status(replayId);
    }

    public ReplayStatus play(String replayId) {
        getEngine(replayId).play();
        return status(replayId);
    }

    public ReplayStatus pause(String replayId) {
        getEngine(replayId).pause();
        return status(replayId);
    }

    public ReplayStatus stop(String replayId) {
        getEngine(replayId).stop();
        return status(replayId);
    }

    public ReplayStatus setSpeed(String replayId, double multiplier) {
        getEngine(replayId).setPlaybackSpeed(multiplier);
        return status(replayId);
    }

    public ReplayStatistics statistics(String replayId) {
        return getEngine(replayId).statistics();
    }

    /**
     * Discard a replay. Idempotent.
     */
    public void close(String replayId) {
        ReplayEngine engine = replays.remove(replayId);
        if (engine != null) {
            engine.close();
            logger.info("Replay {} closed", replayId);
        }
    }

    public int getReplayCount() {
        return replays.size();
    }

    /**
     * Advance every playing replay.
     */
    @Scheduled(fixedDelayString = "${molcollab.replay.tick-interval-ms:50}")
    public void tickPlaying() {
        replays.forEach((replayId, engine) -> {
            if (engine.getPlaybackState() != PlaybackState.PLAYING) {
                return;
            }
            try {
                engine.tick();
            } catch (ReplayException e) {
                logger.warn("Replay {} paused: {}", replayId, e.getMessage());
                engine.pause();
            } catch (RuntimeException e) {
                logger.error("Replay {} paused after unexpected error", replayId, e);
                engine.pause();
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        replays.keySet().forEach(this::close);
    }
}
