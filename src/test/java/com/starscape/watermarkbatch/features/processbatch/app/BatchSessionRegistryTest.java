package com.starscape.watermarkbatch.features.processbatch.app;

import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.batches.domain.BatchStore;
import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingBackend;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchMonitor;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchProgressAggregator;
import com.starscape.watermarkbatch.features.trackprogress.app.BatchSnapshotReader;
import com.starscape.watermarkbatch.features.trackprogress.app.MonitorHandle;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BatchSessionRegistryTest {
    
    private BatchSnapshotReader reader;
    private BatchStore store;
    private ProcessingBackend backend;
    private BatchMonitor monitor;
    private BatchProcessingProperties properties;
    private BatchSessionRegistry registry;
    
    @BeforeEach
    void setUp() {
        reader = mock(BatchSnapshotReader.class);
        store = mock(BatchStore.class);
        backend = mock(ProcessingBackend.class);
        monitor = mock(BatchMonitor.class);
        properties = new BatchProcessingProperties();
        
        when(monitor.start(any(), any(), any())).thenReturn(mock(MonitorHandle.class));
        when(backend.triggerProcessing(any())).thenReturn(new CompletableFuture<>());
        
        registry = new BatchSessionRegistry(
            reader, store, backend, monitor, new TriggerLedger(), mock(SessionListener.class), properties);
    }
    
    @Test
    void liveSessionIsReused() {
        givenBatch("bat_1", BatchStatus.PENDING);
        
        BatchSession first = registry.startOrResume("bat_1");
        BatchSession second = registry.startOrResume("bat_1");
        
        assertThat(second).isSameAs(first);
        verify(backend, times(1)).triggerProcessing("bat_1");
        verify(reader, times(1)).read(eq("bat_1"), anyLong());
    }
    
    @Test
    void endedSessionIsReplaced() {
        givenBatch("bat_1", BatchStatus.COMPLETED);
        
        BatchSession first = registry.startOrResume("bat_1");
        BatchSession second = registry.startOrResume("bat_1");
        
        assertThat(first.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(second).isNotSameAs(first);
        assertThat(registry.find("bat_1")).contains(second);
    }
    
    @Test
    void cancelWithoutSessionIsRejected() {
        assertThat(registry.cancel("bat_missing")).isFalse();
        verifyNoInteractions(store);
    }
    
    @Test
    void cancelDelegatesToRunningSession() {
        givenBatch("bat_1", BatchStatus.PROCESSING);
        registry.startOrResume("bat_1");
        
        assertThat(registry.cancel("bat_1")).isTrue();
        assertThat(registry.find("bat_1").get().getState()).isEqualTo(SessionState.FAILED);
        verify(store).updateBatchStatus("bat_1", BatchStatus.FAILED);
    }
    
    @Test
    void pauseIsNeverApplied() {
        givenBatch("bat_1", BatchStatus.PROCESSING);
        registry.startOrResume("bat_1");
        
        assertThat(registry.pause("bat_1")).isFalse();
        assertThat(registry.pause("bat_other")).isFalse();
    }
    
    @Test
    void sweepEvictsOnlyEndedSessions() {
        properties.setSessionRetention(Duration.ZERO);
        givenBatch("bat_done", BatchStatus.COMPLETED);
        givenBatch("bat_live", BatchStatus.PROCESSING);
        registry.startOrResume("bat_done");
        registry.startOrResume("bat_live");
        
        await().atMost(Duration.ofSeconds(2)).until(() -> {
            registry.evictEndedSessions();
            return registry.size() == 1;
        });
        
        assertThat(registry.find("bat_done")).isEmpty();
        assertThat(registry.find("bat_live")).isPresent();
    }
    
    private void givenBatch(String batchId, BatchStatus status) {
        List<ItemProgress> items = List.of(new ItemProgress(
            "itm_1", "doc.pdf", 1024,
            status == BatchStatus.COMPLETED ? ItemStatus.COMPLETED : ItemStatus.QUEUED,
            status == BatchStatus.COMPLETED ? 100 : 0,
            null));
        when(reader.read(eq(batchId), anyLong())).thenReturn(new BatchSnapshot(
            batchId, status, BatchMode.BATCH, items, BatchProgressAggregator.aggregate(items), 0L, Instant.now()));
    }
}
