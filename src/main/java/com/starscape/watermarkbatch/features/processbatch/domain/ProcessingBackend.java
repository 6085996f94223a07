package com.starscape.watermarkbatch.features.processbatch.domain;

import java.util.concurrent.CompletableFuture;

/**
 * The watermarking backend, which does the per-document work and persists item and batch status.
 */
public interface ProcessingBackend {
    
    /**
     * Ask the backend to process a batch. Returns once the request is accepted; the future
     * completes when the backend reports the batch finished, which may take arbitrarily long.
     * The future fails with {@link ProcessingException} if the backend could not process the batch.
     * 
     * @throws ProcessingException if the request itself is rejected
     */
    CompletableFuture<Void> triggerProcessing(String batchId);
}
