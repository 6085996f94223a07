package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;

import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control handle for one running {@link BatchMonitor} loop.
 */
public class MonitorHandle {
    
    private final String batchId;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledTick;
    private volatile BatchSnapshot lastPublished;
    
    MonitorHandle(String batchId) {
        this.batchId = batchId;
    }
    
    public String getBatchId() {
        return batchId;
    }
    
    public boolean isStopped() {
        return stopped.get();
    }
    
    public Optional<BatchSnapshot> getLastPublished() {
        return Optional.ofNullable(lastPublished);
    }
    
    /**
     * Stops the loop. Safe to call repeatedly and after the loop ended on its own.
     * A tick already in flight finishes its read but publishes nothing.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> tick = scheduledTick;
        if (tick != null) {
            tick.cancel(false);
        }
    }
    
    void attach(ScheduledFuture<?> tick) {
        this.scheduledTick = tick;
        // stop() may have run before the schedule call returned
        if (stopped.get()) {
            tick.cancel(false);
        }
    }
    
    void recordPublished(BatchSnapshot snapshot) {
        this.lastPublished = snapshot;
    }
}
