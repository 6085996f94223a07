package com.starscape.watermarkbatch.features.processbatch.infra.messages;

import java.time.Instant;

/**
 * Command sent to the watermarking backend's processing queue.
 */
public record ProcessBatchMessage(
    String batchId,
    Instant requestedAt
) {}
