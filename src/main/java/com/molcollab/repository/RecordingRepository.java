package com.molcollab.repository;

import com.molcollab.model.Recording;

import java.util.List;
import java.util.Optional;

public interface RecordingRepository {

    Recording save(Recording recording);

    Optional<Recording> findById(String recordingId);

    List<Recording> findAll();
}
