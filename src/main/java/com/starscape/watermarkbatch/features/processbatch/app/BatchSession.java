package com.starscape.watermarkbatch.features.processbatch.app;

import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.batches.domain.BatchStore;
import com.starscape.watermarkbatch.features.processbatch.domain.InitializationException;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingBackend;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchMonitor;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchSnapshotReader;
import com.starscape.watermarkbatch.features.trackprogress.app.MonitorHandle;
import com.starscape.watermarkbatch.features.trackprogress.app.MonitorListener;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one batch from "not yet started" to a terminal state.
 *
 * Two activities run concurrently once the session is RUNNING: the backend processing call
 * and a {@link BatchMonitor} loop. Whichever reports completion first ends the session; the
 * batch is then re-read once so the final snapshot reflects the store.
 *
 * The only state shared between those activities and {@link #cancel()} is the stop flag and
 * the latest snapshot. The stop flag is claimed by whichever path ends the session, so
 * completion, failure and cancellation are mutually exclusive. Claiming the flag and publishing
 * a monitor snapshot hold the same lock, so no progress is published after the session ends.
 *
 * Cancellation is advisory: the backend cannot be interrupted, so cancelling only marks the
 * batch failed and stops this session from observing it. Documents already being watermarked
 * may still finish on the backend side.
 */
public class BatchSession {
    
    private static final Logger log = LoggerFactory.getLogger(BatchSession.class);
    
    private final String batchId;
    private final BatchSnapshotReader snapshotReader;
    private final BatchStore batchStore;
    private final ProcessingBackend processingBackend;
    private final BatchMonitor batchMonitor;
    private final TriggerLedger triggerLedger;
    private final SessionListener listener;
    private final Duration pollInterval;
    private final Duration triggerTimeout;
    
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.NOT_STARTED);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CompletableFuture<SessionOutcome> outcome = new CompletableFuture<>();
    private final Object publishLock = new Object();
    
    private volatile BatchSnapshot latestSnapshot;
    private volatile MonitorHandle monitorHandle;
    private volatile CompletableFuture<Void> processingCall;
    private volatile BatchMode mode = BatchMode.BATCH;
    private volatile Instant terminatedAt;
    
    public BatchSession(
            String batchId,
            BatchSnapshotReader snapshotReader,
            BatchStore batchStore,
            ProcessingBackend processingBackend,
            BatchMonitor batchMonitor,
            TriggerLedger triggerLedger,
            SessionListener listener,
            Duration pollInterval,
            Duration triggerTimeout) {
        this.batchId = batchId;
        this.snapshotReader = snapshotReader;
        this.batchStore = batchStore;
        this.processingBackend = processingBackend;
        this.batchMonitor = batchMonitor;
        this.triggerLedger = triggerLedger;
        this.listener = listener;
        this.pollInterval = pollInterval;
        this.triggerTimeout = triggerTimeout;
    }
    
    /**
     * Load the batch and start or resume it.
     *
     * - pending: trigger backend processing and start monitoring
     * - processing: monitor only, processing is never triggered twice
     * - completed/failed: end immediately
     *
     * @return future completed with the session outcome; completed exceptionally with
     *         {@link ProcessingException} if backend processing fails
     * @throws InitializationException if the batch or its items cannot be loaded
     * @throws ProcessingException if the backend rejects the processing request
     */
    public CompletableFuture<SessionOutcome> initialize() {
        if (!initialized.compareAndSet(false, true)) {
            throw new IllegalStateException("Session for batch " + batchId + " is already initialized");
        }
        
        BatchSnapshot initial;
        try {
            initial = snapshotReader.read(batchId, 0L);
        } catch (RuntimeException e) {
            InitializationException failure = new InitializationException(
                "Batch " + batchId + " could not be loaded: " + e.getMessage(), e);
            stopRequested.set(true);
            endIn(SessionState.FAILED);
            outcome.completeExceptionally(failure);
            log.error("Batch session failed to initialize: batchId={}", batchId, e);
            throw failure;
        }
        
        mode = initial.mode();
        latestSnapshot = initial;
        listener.onProgress(initial);
        
        switch (initial.batchStatus()) {
            case PENDING -> {
                state.set(SessionState.STARTING);
                log.info("Starting batch session: batchId={}, items={}", batchId, initial.summary().total());
                beginProcessing();
            }
            case PROCESSING -> {
                state.set(SessionState.RUNNING);
                log.info("Resuming batch session without re-triggering processing: batchId={}", batchId);
                attachMonitor();
            }
            case COMPLETED, FAILED -> {
                log.info("Batch already terminal, nothing to run: batchId={}, status={}",
                    batchId, initial.batchStatus().value());
                stopRequested.set(true);
                settle(initial);
            }
        }
        return outcome;
    }
    
    /**
     * Trigger backend processing and start the monitor alongside it.
     * An accepted trigger goes out at most once per batch per process; a rejected one is
     * released so a later session can retry it.
     */
    private void beginProcessing() {
        if (!triggerLedger.markTriggered(batchId)) {
            log.warn("Processing already triggered for batch {} in this process, monitoring only", batchId);
            state.set(SessionState.RUNNING);
            attachMonitor();
            return;
        }
        
        CompletableFuture<Void> trigger;
        try {
            trigger = processingBackend.triggerProcessing(batchId);
        } catch (RuntimeException e) {
            triggerLedger.release(batchId);
            ProcessingException failure = e instanceof ProcessingException processingFailure
                ? processingFailure
                : new ProcessingException("Processing request rejected for batch " + batchId, e);
            fail(failure);
            throw failure;
        }
        
        processingCall = trigger;
        state.set(SessionState.RUNNING);
        log.info("Batch processing triggered: batchId={}", batchId);
        attachMonitor();
        trigger.orTimeout(triggerTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> onTriggerResolved(error));
    }
    
    /**
     * Cancel a running batch. Marks the batch failed in the store and stops monitoring.
     *
     * @return false if the session was not RUNNING; nothing changes in that case
     */
    public boolean cancel() {
        SessionState current = state.get();
        if (current != SessionState.RUNNING) {
            log.info("Cancel ignored, session not running: batchId={}, state={}", batchId, current);
            return false;
        }
        if (!claimStop()) {
            log.info("Cancel ignored, session already ending: batchId={}", batchId);
            return false;
        }
        
        state.set(SessionState.CANCELLING);
        stopMonitor();
        releaseProcessingCall();
        try {
            batchStore.updateBatchStatus(batchId, BatchStatus.FAILED);
        } catch (RuntimeException e) {
            log.warn("Could not persist cancellation, batch stays failed for this session only: batchId={}",
                batchId, e);
        }
        
        BatchSnapshot cancelled = latestSnapshot.withStatus(BatchStatus.FAILED);
        latestSnapshot = cancelled;
        endIn(SessionState.FAILED);
        listener.onProgress(cancelled);
        
        SessionOutcome result = SessionOutcome.cancelled(cancelled);
        outcome.complete(result);
        listener.onTerminal(result);
        
        log.info("Batch cancelled: batchId={}. Documents already on the backend are not interrupted", batchId);
        return true;
    }
    
    /**
     * Pausing is not supported by the backend. The request is acknowledged and ignored.
     *
     * @return always false
     */
    public boolean pause() {
        log.info("Pause requested but not supported, processing continues: batchId={}, state={}",
            batchId, state.get());
        return false;
    }
    
    public String getBatchId() {
        return batchId;
    }
    
    public SessionState getState() {
        return state.get();
    }
    
    public BatchMode getMode() {
        return mode;
    }
    
    public Optional<BatchSnapshot> getLatestSnapshot() {
        return Optional.ofNullable(latestSnapshot);
    }
    
    public Optional<Instant> getTerminatedAt() {
        return Optional.ofNullable(terminatedAt);
    }
    
    public CompletableFuture<SessionOutcome> outcome() {
        return outcome;
    }
    
    private void attachMonitor() {
        MonitorHandle handle = batchMonitor.start(batchId, pollInterval, new SessionMonitorListener());
        monitorHandle = handle;
        if (stopRequested.get()) {
            handle.stop();
        }
    }
    
    private void stopMonitor() {
        MonitorHandle handle = monitorHandle;
        if (handle != null) {
            handle.stop();
        }
    }
    
    /**
     * Stop waiting on the backend's reply once the session has ended some other way.
     */
    private void releaseProcessingCall() {
        CompletableFuture<Void> call = processingCall;
        if (call != null && !call.isDone()) {
            call.cancel(false);
        }
    }
    
    private boolean claimStop() {
        synchronized (publishLock) {
            return stopRequested.compareAndSet(false, true);
        }
    }
    
    private void onTriggerResolved(Throwable error) {
        if (stopRequested.get()) {
            log.debug("Processing call resolved after session ended: batchId={}", batchId);
            return;
        }
        if (error == null) {
            log.info("Backend reported batch finished: batchId={}", batchId);
            finish();
            return;
        }
        
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        ProcessingException failure;
        if (cause instanceof ProcessingException processingFailure) {
            failure = processingFailure;
        } else if (cause instanceof TimeoutException) {
            failure = new ProcessingException(
                "Processing of batch " + batchId + " did not finish within " + triggerTimeout, cause);
        } else {
            failure = new ProcessingException("Processing failed for batch " + batchId, cause);
        }
        fail(failure);
    }
    
    /**
     * First completion signal wins; later ones find the stop flag set and return.
     */
    private void finish() {
        if (!claimStop()) {
            return;
        }
        stopMonitor();
        releaseProcessingCall();
        settle(reconcile());
    }
    
    private BatchSnapshot reconcile() {
        BatchSnapshot observed = latestSnapshot;
        BatchSnapshot authoritative;
        try {
            authoritative = snapshotReader.read(batchId, observed.sequence() + 1);
        } catch (RuntimeException e) {
            log.warn("Final re-read failed, keeping last observed state: batchId={}", batchId, e);
            authoritative = observed;
        }
        
        if (authoritative.batchStatus().isTerminal()) {
            return authoritative;
        }
        
        boolean allFailed = authoritative.summary().total() > 0
            && authoritative.summary().failed() == authoritative.summary().total();
        BatchStatus derived = allFailed ? BatchStatus.FAILED : BatchStatus.COMPLETED;
        log.warn("Backend finished but store still reports {}, using {} from item states: batchId={}",
            authoritative.batchStatus().value(), derived.value(), batchId);
        return authoritative.withStatus(derived);
    }
    
    private void settle(BatchSnapshot finalSnapshot) {
        latestSnapshot = finalSnapshot;
        endIn(finalSnapshot.batchStatus() == BatchStatus.COMPLETED ? SessionState.COMPLETED : SessionState.FAILED);
        listener.onProgress(finalSnapshot);
        
        SessionOutcome result = SessionOutcome.finished(finalSnapshot);
        outcome.complete(result);
        listener.onTerminal(result);
        
        log.info("Batch session finished: batchId={}, status={}, completed={}, failed={}, total={}",
            batchId, finalSnapshot.batchStatus().value(), finalSnapshot.summary().completed(),
            finalSnapshot.summary().failed(), finalSnapshot.summary().total());
    }
    
    private void fail(ProcessingException failure) {
        if (!claimStop()) {
            return;
        }
        stopMonitor();
        releaseProcessingCall();
        endIn(SessionState.FAILED);
        log.error("Batch processing failed: batchId={}", batchId, failure);
        
        outcome.completeExceptionally(failure);
        listener.onTerminal(SessionOutcome.failed(batchId, mode, latestSnapshot, failure.getMessage()));
    }
    
    private void endIn(SessionState terminal) {
        terminatedAt = Instant.now();
        state.set(terminal);
    }
    
    /**
     * Items only move forward. A snapshot that moves one backwards is still published
     * since the store is authoritative, but the regression is logged.
     */
    private void warnOnRegressions(BatchSnapshot previous, BatchSnapshot next) {
        if (previous == null) {
            return;
        }
        Map<String, ItemProgress> before = previous.items().stream()
            .collect(Collectors.toMap(ItemProgress::id, Function.identity(), (first, second) -> second));
        for (ItemProgress item : next.items()) {
            ItemProgress earlier = before.get(item.id());
            if (earlier != null && !earlier.status().canTransitionTo(item.status())) {
                log.warn("Item status moved backwards: batchId={}, itemId={}, from={}, to={}",
                    batchId, item.id(), earlier.status().value(), item.status().value());
            }
        }
    }
    
    private final class SessionMonitorListener implements MonitorListener {
        
        @Override
        public void onSnapshot(BatchSnapshot snapshot) {
            synchronized (publishLock) {
                if (stopRequested.get()) {
                    return;
                }
                warnOnRegressions(latestSnapshot, snapshot);
                latestSnapshot = snapshot;
                listener.onProgress(snapshot);
            }
        }
        
        @Override
        public void onTerminalStatus(BatchSnapshot snapshot) {
            log.info("Monitor observed terminal batch status: batchId={}, status={}",
                batchId, snapshot.batchStatus().value());
            finish();
        }
        
        @Override
        public void onDegraded(String degradedBatchId, int consecutiveFailures) {
            if (!stopRequested.get()) {
                listener.onDegraded(degradedBatchId, consecutiveFailures);
            }
        }
    }
}
