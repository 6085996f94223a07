package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;

/**
 * Receives what a {@link BatchMonitor} observes. Called from monitor threads.
 */
public interface MonitorListener {
    
    /**
     * A tick succeeded and produced a snapshot fresher than any published before.
     */
    void onSnapshot(BatchSnapshot snapshot);
    
    /**
     * The batch reached a terminal status; the monitor has already stopped itself.
     */
    void onTerminalStatus(BatchSnapshot snapshot);
    
    /**
     * Polling has failed this many times in a row.
     */
    void onDegraded(String batchId, int consecutiveFailures);
}
