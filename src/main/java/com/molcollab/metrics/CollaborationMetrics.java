package com.molcollab.metrics;

import com.molcollab.dto.ErrorResponse.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counters for recording activity and rejected client messages.
 */
@Component
public class CollaborationMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter recordingsStarted;
    private final Counter recordingsFinalized;

    public CollaborationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.recordingsStarted = Counter.builder("molcollab.recordings.started")
                .description("Recordings started in live rooms")
                .register(meterRegistry);
        this.recordingsFinalized = Counter.builder("molcollab.recordings.finalized")
                .description("Recordings stopped or closed with their room and stored")
                .register(meterRegistry);
    }

    public void recordingStarted() {
        recordingsStarted.increment();
    }

    public void recordingFinalized() {
        recordingsFinalized.increment();
    }

    public void messageRejected(ErrorCode code) {
        meterRegistry.counter("molcollab.messages.rejected", "code", code.getCode()).increment();
    }
}
