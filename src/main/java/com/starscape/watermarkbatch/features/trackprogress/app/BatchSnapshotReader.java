package com.starscape.watermarkbatch.features.trackprogress.app;

import com.starscape.watermarkbatch.common.config.BatchProcessingProperties;
import com.starscape.watermarkbatch.features.batches.domain.BatchItemRecord;
import com.starscape.watermarkbatch.features.batches.domain.BatchMode;
import com.starscape.watermarkbatch.features.batches.domain.BatchRecord;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.batches.domain.BatchStore;
import com.starscape.watermarkbatch.features.trackprogress.domain.BatchSnapshot;
import com.starscape.watermarkbatch.features.trackprogress.domain.DecodeException;
import com.starscape.watermarkbatch.features.trackprogress.domain.ItemProgress;
import com.starscape.watermarkbatch.features.trackprogress.domain.TransientFetchException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads a batch and its items from the store, decodes them and aggregates progress.
 * 
 * The batch read and the item read run in parallel and share one time budget.
 * Store and decode failures are rethrown as they are; a read that exceeds the
 * budget or is interrupted becomes a {@link TransientFetchException}.
 */
@Component
public class BatchSnapshotReader {
    
    private final BatchStore batchStore;
    private final Executor fetchExecutor;
    private final Duration readTimeout;
    
    public BatchSnapshotReader(
            BatchStore batchStore,
            @Qualifier("batchFetchExecutor") Executor fetchExecutor,
            BatchProcessingProperties properties) {
        this.batchStore = batchStore;
        this.fetchExecutor = fetchExecutor;
        this.readTimeout = properties.getTickTimeout();
    }
    
    public BatchSnapshot read(String batchId, long sequence) {
        CompletableFuture<BatchRecord> batchRead = CompletableFuture.supplyAsync(
            () -> batchStore.getBatch(batchId), fetchExecutor);
        CompletableFuture<List<BatchItemRecord>> itemsRead = CompletableFuture.supplyAsync(
            () -> batchStore.getBatchItems(batchId), fetchExecutor);
        
        try {
            CompletableFuture.allOf(batchRead, itemsRead).get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            batchRead.cancel(true);
            itemsRead.cancel(true);
            throw new TransientFetchException(
                "Reading batch " + batchId + " took longer than " + readTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while reading batch " + batchId, e);
        } catch (ExecutionException e) {
            throw unwrap(batchId, e);
        }
        
        return toSnapshot(batchRead.join(), itemsRead.join(), sequence);
    }
    
    static BatchSnapshot toSnapshot(BatchRecord batch, List<BatchItemRecord> itemRecords, long sequence) {
        BatchStatus status = BatchStatus.fromValue(batch.status())
                .orElseThrow(() -> new DecodeException(
                    "Batch " + batch.id() + " has unknown status: " + batch.status()));
        List<ItemProgress> items = itemRecords.stream()
                .map(ItemProgress::fromStoreRecord)
                .toList();
        
        return new BatchSnapshot(
            batch.id(),
            status,
            BatchMode.fromValue(batch.mode()),
            items,
            BatchProgressAggregator.aggregate(items),
            sequence,
            Instant.now()
        );
    }
    
    private RuntimeException unwrap(String batchId, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new TransientFetchException("Failed to read batch " + batchId, cause);
    }
}
