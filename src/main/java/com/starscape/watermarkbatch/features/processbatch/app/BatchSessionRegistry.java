package com.starscape.watermarkbatch.features.processbatch.app;

import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import com.starscape.watermarkbatch.features.batches.domain.BatchStore;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingBackend;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchMonitor;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchSnapshotReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the live {@link BatchSession}s of this process, at most one per batch.
 * Entry point for the processing commands.
 */
@Service
public class BatchSessionRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(BatchSessionRegistry.class);
    
    private final ConcurrentMap<String, BatchSession> sessions = new ConcurrentHashMap<>();
    
    private final BatchSnapshotReader snapshotReader;
    private final BatchStore batchStore;
    private final ProcessingBackend processingBackend;
    private final BatchMonitor batchMonitor;
    private final TriggerLedger triggerLedger;
    private final SessionListener sessionListener;
    private final BatchProcessingProperties properties;
    
    public BatchSessionRegistry(
            BatchSnapshotReader snapshotReader,
            BatchStore batchStore,
            ProcessingBackend processingBackend,
            BatchMonitor batchMonitor,
            TriggerLedger triggerLedger,
            SessionListener sessionListener,
            BatchProcessingProperties properties) {
        this.snapshotReader = snapshotReader;
        this.batchStore = batchStore;
        this.processingBackend = processingBackend;
        this.batchMonitor = batchMonitor;
        this.triggerLedger = triggerLedger;
        this.sessionListener = sessionListener;
        this.properties = properties;
    }
    
    /**
     * Start processing a batch, or return the session already running it.
     * A session that has ended is replaced by a fresh one, which re-reads the batch.
     * 
     * @throws com.starscape.watermarkbatch.features.processbatch.domain.InitializationException if the batch cannot be loaded
     * @throws com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException if the backend rejects the request
     */
    public BatchSession startOrResume(String batchId) {
        BatchSession candidate = newSession(batchId);
        BatchSession session = sessions.compute(batchId, (id, current) ->
            current == null || current.getState().isTerminal() ? candidate : current);
        
        if (session != candidate) {
            log.debug("Reusing live session: batchId={}, state={}", batchId, session.getState());
            return session;
        }
        
        session.initialize();
        return session;
    }
    
    public Optional<BatchSession> find(String batchId) {
        return Optional.ofNullable(sessions.get(batchId));
    }
    
    /**
     * @return false when there is no running session for the batch
     */
    public boolean cancel(String batchId) {
        BatchSession session = sessions.get(batchId);
        if (session == null) {
            log.info("Cancel ignored, no session for batch {}", batchId);
            return false;
        }
        return session.cancel();
    }
    
    public boolean pause(String batchId) {
        return find(batchId).map(BatchSession::pause).orElse(false);
    }
    
    /**
     * Drop sessions that ended longer ago than the retention window.
     */
    @Scheduled(fixedDelayString = "${app.batch.session-sweep-interval-ms:60000}")
    public void evictEndedSessions() {
        Instant cutoff = Instant.now().minus(properties.getSessionRetention());
        int before = sessions.size();
        sessions.values().removeIf(session -> session.getState().isTerminal()
            && session.getTerminatedAt().map(end -> end.isBefore(cutoff)).orElse(false));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.debug("Evicted {} ended batch sessions", evicted);
        }
    }
    
    int size() {
        return sessions.size();
    }
    
    private BatchSession newSession(String batchId) {
        return new BatchSession(
            batchId,
            snapshotReader,
            batchStore,
            processingBackend,
            batchMonitor,
            triggerLedger,
            sessionListener,
            properties.getPollInterval(),
            properties.getTriggerTimeout()
        );
    }
}
