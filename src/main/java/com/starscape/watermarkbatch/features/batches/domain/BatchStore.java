package com.starscape.watermarkbatch.features.batches.domain;

import java.util.List;

/**
 * Authoritative persisted state for batches and their items.
 */
public interface BatchStore {
    
    /**
     * @throws com.starscape.watermarkbatch.common.exception.NotFoundException if the batch is unknown
     */
    BatchRecord getBatch(String batchId);
    
    /**
     * Items of the batch in submission order.
     */
    List<BatchItemRecord> getBatchItems(String batchId);
    
    /**
     * Moves the batch to the given status unless it is already terminal.
     * @return true if the stored status changed
     */
    boolean updateBatchStatus(String batchId, BatchStatus status);
}
