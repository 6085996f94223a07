package com.starscape.watermarkbatch.features.dashboard.api.dto;

import java.time.Instant;

/**
 * status is one of completed, processing, info, warning, failed.
 */
public record ActivityItem(
    String id,
    String action,
    String description,
    Instant time,
    String relativeTime,
    String status,
    String batchId
) {}
