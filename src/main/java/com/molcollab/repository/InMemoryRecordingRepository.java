package com.molcollab.repository;

import com.molcollab.model.Recording;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime recording store.
 */
@Repository
public class InMemoryRecordingRepository implements RecordingRepository {

    private final Map<String, Recording> byId = new ConcurrentHashMap<>();

    @Override
    public Recording save(Recording recording) {
        byId.put(recording.recordingId(), recording);
        return recording;
    }

    @Override
    public Optional<Recording> findById(String recordingId) {
        return Optional.ofNullable(byId.get(recordingId));
    }

    @Override
    public List<Recording> findAll() {
        List<Recording> all = new ArrayList<>(byId.values());
        all.sort(Comparator.comparing(Recording::recordingId));
        return all;
    }
}
