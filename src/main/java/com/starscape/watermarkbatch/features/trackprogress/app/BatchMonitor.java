package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import com.starscape.watermarkbatch.features.trackprogress.domain.TransientFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the batch store for one batch at a fixed delay and publishes each fresh snapshot.
 * 
 * Responsibilities:
 * - One tick = read batch + items, decode, aggregate, publish
 * - Failed ticks are logged and skipped; the last published snapshot stays current
 * - Sustained failure is surfaced through {@link MonitorListener#onDegraded}
 * - The loop ends by itself once the batch status is terminal, or when its handle is stopped
 */
@Component
public class BatchMonitor {
    
    private static final Logger log = LoggerFactory.getLogger(BatchMonitor.class);
    
    private final BatchSnapshotReader snapshotReader;
    private final TaskScheduler scheduler;
    private final int degradedThreshold;
    
    public BatchMonitor(
            BatchSnapshotReader snapshotReader,
            @Qualifier("batchMonitorScheduler") TaskScheduler scheduler,
            BatchProcessingProperties properties) {
        this.snapshotReader = snapshotReader;
        this.scheduler = scheduler;
        this.degradedThreshold = Math.max(1, properties.getDegradedThreshold());
    }
    
    /**
     * Start polling. The first tick runs immediately.
     * @param interval delay between the end of one tick and the start of the next; must be positive
     */
    public MonitorHandle start(String batchId, Duration interval, MonitorListener listener) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        
        MonitorHandle handle = new MonitorHandle(batchId);
        PollingTask task = new PollingTask(handle, listener);
        ScheduledFuture<?> tick = scheduler.scheduleWithFixedDelay(task, interval);
        handle.attach(tick);
        
        log.info("Started batch monitor: batchId={}, interval={}ms", batchId, interval.toMillis());
        return handle;
    }
    
    final class PollingTask implements Runnable {
        
        private final MonitorHandle handle;
        private final MonitorListener listener;
        private final AtomicLong nextSequence = new AtomicLong();
        private final AtomicLong lastApplied = new AtomicLong();
        private final AtomicInteger consecutiveFailures = new AtomicInteger();
        
        PollingTask(MonitorHandle handle, MonitorListener listener) {
            this.handle = handle;
            this.listener = listener;
        }
        
        @Override
        public void run() {
            // An exception escaping here would silently cancel the schedule
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Unexpected error in batch monitor tick: batchId={}", handle.getBatchId(), e);
            }
        }
        
        private void tick() {
            if (handle.isStopped()) {
                return;
            }
            
            long sequence = nextSequence.incrementAndGet();
            BatchSnapshot snapshot;
            try {
                snapshot = snapshotReader.read(handle.getBatchId(), sequence);
            } catch (RuntimeException e) {
                onTickFailed(e);
                return;
            }
            
            if (handle.isStopped()) {
                log.debug("Discarding tick {} for stopped monitor: batchId={}", sequence, handle.getBatchId());
                return;
            }
            if (lastApplied.getAndAccumulate(sequence, Math::max) >= sequence) {
                log.debug("Discarding stale tick {}: batchId={}", sequence, handle.getBatchId());
                return;
            }
            
            consecutiveFailures.set(0);
            handle.recordPublished(snapshot);
            listener.onSnapshot(snapshot);
            
            log.debug("Batch tick applied: batchId={}, status={}, settled={}/{}",
                handle.getBatchId(), snapshot.batchStatus().value(),
                snapshot.summary().settled(), snapshot.summary().total());
            
            if (snapshot.batchStatus().isTerminal()) {
                handle.stop();
                log.info("Batch reached terminal status, monitor stopped: batchId={}, status={}",
                    handle.getBatchId(), snapshot.batchStatus().value());
                listener.onTerminalStatus(snapshot);
            }
        }
        
        private void onTickFailed(RuntimeException e) {
            TransientFetchException failure = e instanceof TransientFetchException transientFailure
                ? transientFailure
                : new TransientFetchException("Poll failed for batch " + handle.getBatchId(), e);
            int failures = consecutiveFailures.incrementAndGet();
            
            log.warn("Batch poll tick skipped: batchId={}, consecutiveFailures={}, reason={}",
                handle.getBatchId(), failures, rootMessage(failure));
            
            if (failures % degradedThreshold == 0 && !handle.isStopped()) {
                log.warn("Batch monitor degraded: batchId={}, consecutiveFailures={}",
                    handle.getBatchId(), failures);
                listener.onDegraded(handle.getBatchId(), failures);
            }
        }
        
        private String rootMessage(Throwable failure) {
            Throwable root = failure;
            while (root.getCause() != null && root.getCause() != root) {
                root = root.getCause();
            }
            return root.getClass().getSimpleName() + ": " + root.getMessage();
        }
    }
}
