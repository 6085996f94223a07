package com.starscape.watermarkbatch.features.trackprogress.api.dto;

import com.starscape.watermarkbatch.features.processbatch.app.SessionOutcome;
import com.starscape.watermarkbatch.features.trackprogress.domain.ProgressSummary;

import java.time.Instant;

/**
 * Final message for a batch topic. result tells clients whether to show results,
 * an error, or return to the upload page; mode selects the single-document or batch result view.
 */
public record BatchTerminalUpdate(
    String batchId,
    String result,
    String mode,
    int totalCount,
    int completedCount,
    int failedCount,
    String errorMessage,
    Instant timestamp
) {
    public static BatchTerminalUpdate from(SessionOutcome outcome) {
        ProgressSummary summary = outcome.finalSnapshot() != null
            ? outcome.finalSnapshot().summary()
            : ProgressSummary.empty();
        return new BatchTerminalUpdate(
            outcome.batchId(),
            outcome.result().name(),
            outcome.mode().value(),
            summary.total(),
            summary.completed(),
            summary.failed(),
            outcome.errorMessage(),
            Instant.now()
        );
    }
}
