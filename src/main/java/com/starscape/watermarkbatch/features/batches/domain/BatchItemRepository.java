package com.starscape.watermarkbatch.features.batches.domain;

import java.util.List;

public interface BatchItemRepository {
    List<BatchItem> findByBatchIdOrderByCreatedAtAsc(String batchId);
}
