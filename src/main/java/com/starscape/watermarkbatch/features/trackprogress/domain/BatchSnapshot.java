package com.starscape.watermarkbatch.features.trackprogress.domain;

import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of one observation of a batch: its status, decoded items and summary.
 * sequence orders observations made by the same reader; a higher value is a fresher read.
 */
public record BatchSnapshot(
    String batchId,
    BatchStatus batchStatus,
    BatchMode mode,
    List<ItemProgress> items,
    ProgressSummary summary,
    long sequence,
    Instant observedAt
) {
    
    public BatchSnapshot {
        items = List.copyOf(items);
    }
    
    public BatchSnapshot withStatus(BatchStatus status) {
        return new BatchSnapshot(batchId, status, mode, items, summary, sequence, Instant.now());
    }
}
