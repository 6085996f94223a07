package com.starscape.watermarkbatch.features.processbatch.infra;

import com.starscape.watermarkbatch.features.processbatch.domain.ProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Pairs outstanding processing requests with the backend's completion replies.
 */
@Component
public class BatchCompletionTracker {
    
    private static final Logger log = LoggerFactory.getLogger(BatchCompletionTracker.class);
    
    private final ConcurrentMap<String, CompletableFuture<Void>> pending = new ConcurrentHashMap<>();
    
    /**
     * @return the future for the batch; an existing one if a request is already outstanding
     */
    public CompletableFuture<Void> register(String batchId) {
        CompletableFuture<Void> created = new CompletableFuture<>();
        CompletableFuture<Void> completion = pending.putIfAbsent(batchId, created);
        if (completion != null) {
            return completion;
        }
        // Timeouts applied by callers complete the future too
        created.whenComplete((ignored, error) -> pending.remove(batchId, created));
        return created;
    }
    
    public void complete(String batchId) {
        CompletableFuture<Void> completion = pending.remove(batchId);
        if (completion == null) {
            log.debug("No outstanding processing request for batch {}", batchId);
            return;
        }
        completion.complete(null);
    }
    
    public void fail(String batchId, ProcessingException failure) {
        CompletableFuture<Void> completion = pending.remove(batchId);
        if (completion == null) {
            log.debug("No outstanding processing request for batch {}, dropping failure: {}",
                batchId, failure.getMessage());
            return;
        }
        completion.completeExceptionally(failure);
    }
}
