package com.starscape.watermarkbatch.features.processbatch.app;

import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;

/**
 * How a batch session ended. CANCELLED sessions leave the batch marked failed,
 * but are reported separately because cancelling is not a fault.
 */
public record SessionOutcome(
    String batchId,
    Result result,
    BatchMode mode,
    BatchSnapshot finalSnapshot,
    String errorMessage
) {
    
    public enum Result {
        COMPLETED,
        FAILED,
        CANCELLED
    }
    
    public static SessionOutcome finished(BatchSnapshot snapshot) {
        Result result = snapshot.batchStatus() == BatchStatus.COMPLETED
            ? Result.COMPLETED
            : Result.FAILED;
        return new SessionOutcome(snapshot.batchId(), result, snapshot.mode(), snapshot, null);
    }
    
    public static SessionOutcome cancelled(BatchSnapshot snapshot) {
        return new SessionOutcome(snapshot.batchId(), Result.CANCELLED, snapshot.mode(), snapshot, null);
    }
    
    public static SessionOutcome failed(String batchId, BatchMode mode, BatchSnapshot lastSnapshot, String errorMessage) {
        return new SessionOutcome(batchId, Result.FAILED, mode, lastSnapshot, errorMessage);
    }
}
