package com.starscape.watermarkbatch.features.trackprogress.api.dto;

import java.time.Instant;

/**
 * Sent when progress for a batch could not be refreshed several times in a row.
 */
public record ConnectivityWarning(
    String batchId,
    int consecutiveFailures,
    String message,
    Instant timestamp
) {
    public static ConnectivityWarning of(String batchId, int consecutiveFailures) {
        return new ConnectivityWarning(
            batchId,
            consecutiveFailures,
            "Progress updates are delayed: batch status could not be refreshed " + consecutiveFailures + " times in a row",
            Instant.now()
        );
    }
}
