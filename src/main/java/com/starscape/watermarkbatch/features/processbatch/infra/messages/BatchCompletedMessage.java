package com.starscape.watermarkbatch.features.processbatch.infra.messages;

import java.time.Instant;

/**
 * Reply published by the watermarking backend when it is done with a batch.
 * outcome is "completed" or "failed" for a batch that ran to the end, and "error"
 * when the backend could not process the batch at all.
 */
public record BatchCompletedMessage(
    String batchId,
    String outcome,
    String errorMessage,
    Instant completedAt
) {
    
    public static final String OUTCOME_ERROR = "error";
    
    public boolean isError() {
        return OUTCOME_ERROR.equalsIgnoreCase(outcome);
    }
}
