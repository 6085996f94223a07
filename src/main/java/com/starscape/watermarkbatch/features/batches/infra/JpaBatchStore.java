package com.starscape.watermarkbatch.features.batches.infra;

import com.starscape.watermarkbatch.common.exception.NotFoundException;
import com.starscape.watermarkbatch.features.batches.domain.Batch;
import com.starscape.watermarkbatch.features.batches.domain.BatchItemRecord;
import com.starscape.watermarkbatch.features.batches.domain.BatchItemRepository;
import com.starscape.watermarkbatch.features.batches.domain.BatchRecord;
import com.starscape.watermarkbatch.features.batches.domain.BatchRepository;
import com.starscape.watermarkbatch.features.batches.domain.BatchStatus;
import com.starscape.watermarkbatch.features.batches.domain.BatchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * {@link BatchStore} backed by the shared batches/batch_items tables.
 */
@Component
public class JpaBatchStore implements BatchStore {
    
    private static final Logger log = LoggerFactory.getLogger(JpaBatchStore.class);
    
    private final BatchRepository batchRepository;
    private final BatchItemRepository itemRepository;
    
    public JpaBatchStore(BatchRepository batchRepository, BatchItemRepository itemRepository) {
        this.batchRepository = batchRepository;
        this.itemRepository = itemRepository;
    }
    
    @Override
    @Transactional(readOnly = true)
    public BatchRecord getBatch(String batchId) {
        Batch batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new NotFoundException("Batch not found: " + batchId));
        return new BatchRecord(
            batch.getBatchId(),
            batch.getStatus(),
            batch.getWatermarkSettingsJson(),
            batch.getMode(),
            batch.getBatchName(),
            batch.getTotalFiles()
        );
    }
    
    @Override
    @Transactional(readOnly = true)
    public List<BatchItemRecord> getBatchItems(String batchId) {
        return itemRepository.findByBatchIdOrderByCreatedAtAsc(batchId).stream()
                .map(item -> new BatchItemRecord(
                    item.getItemId(),
                    item.getOriginalName(),
                    item.getFileSize(),
                    item.getStatus(),
                    item.getProgress(),
                    item.getErrorMessage()
                ))
                .toList();
    }
    
    @Override
    @Transactional
    public boolean updateBatchStatus(String batchId, BatchStatus status) {
        Instant now = Instant.now();
        Instant completedAt = status.isTerminal() ? now : null;
        int updated = batchRepository.updateStatusUnlessTerminal(batchId, status.value(), completedAt, now);
        if (updated == 0) {
            log.warn("Batch status not updated: batchId={}, requested={} (unknown or already terminal)",
                batchId, status.value());
            return false;
        }
        log.info("Batch status updated: batchId={}, status={}", batchId, status.value());
        return true;
    }
}
