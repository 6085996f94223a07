package com.starscape.watermarkbatch.features.batches.domain;

import java.time.Instant;
import java.util.Optional;

public interface BatchRepository {
    Batch save(Batch batch);
    Optional<Batch> findById(String batchId);
    int updateStatusUnlessTerminal(String batchId, String status, Instant completedAt, Instant updatedAt);
}
