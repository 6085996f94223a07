package com.starscape.watermarkbatch.features.getbatch.api.dto;

import com.starscape.watermarkbatch.features.trackprogress.api.dto.ItemProgressView;

import java.time.Instant;
import java.util.List;

/**
 * sessionState is null when no session in this process is driving the batch.
 */
public record BatchStatusResponse(
    String batchId,
    String batchStatus,
    String mode,
    String sessionState,
    double overallProgress,
    int totalCount,
    int completedCount,
    int failedCount,
    int remainingCount,
    List<ItemProgressView> items,
    Instant observedAt
) {}
