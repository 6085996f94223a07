package com.starscape.watermarkbatch.features.processbatch.app;

import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;

/**
 * Receives everything a batch session makes visible to clients.
 */
public interface SessionListener {
    
    void onProgress(BatchSnapshot snapshot);
    
    void onDegraded(String batchId, int consecutiveFailures);
    
    /**
     * Called exactly once per session that got past loading its batch.
     */
    void onTerminal(SessionOutcome outcome);
}
