package com.starscape.watermarkbatch.features.trackprogress.api.dto;

import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Batch progress DTO for WebSocket broadcasts.
 * Sent every time a fresher snapshot of the batch is observed.
 */
public record BatchProgressUpdate(
    String batchId,
    String batchStatus,
    String mode,
    double overallProgress,
    int totalCount,
    int completedCount,
    int failedCount,
    int remainingCount,
    List<ItemProgressView> items,
    Instant timestamp
) {
    public static BatchProgressUpdate from(BatchSnapshot snapshot) {
        return new BatchProgressUpdate(
            snapshot.batchId(),
            snapshot.batchStatus().value(),
            snapshot.mode().value(),
            snapshot.summary().overallProgress(),
            snapshot.summary().total(),
            snapshot.summary().completed(),
            snapshot.summary().failed(),
            snapshot.summary().remaining(),
            snapshot.items().stream().map(ItemProgressView::from).toList(),
            snapshot.observedAt()
        );
    }
}
