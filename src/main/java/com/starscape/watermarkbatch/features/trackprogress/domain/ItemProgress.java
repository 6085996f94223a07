package com.starscape.watermarkbatch.features.trackprogress.domain;

import com.starscape.watermarkbatch.features.batches.domain.BatchItemRecord;

/**
 * Typed view of one document's progress within a batch.
 * 
 * progress is meaningful only while PROCESSING, is always 100 once COMPLETED
 * and 0 for QUEUED and FAILED. error is only ever set on FAILED items.
 */
public record ItemProgress(
    String id,
    String name,
    long size,
    ItemStatus status,
    int progress,
    String error
) {
    
    public ItemProgress {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100");
        }
    }
    
    /**
     * Maps a raw item row onto the lifecycle model.
     * @throws DecodeException if the row is malformed
     */
    public static ItemProgress fromStoreRecord(BatchItemRecord record) {
        if (record == null) {
            throw new DecodeException("Item record is missing");
        }
        if (record.id() == null || record.id().isBlank()) {
            throw new DecodeException("Item record has no id");
        }
        if (record.name() == null) {
            throw new DecodeException("Item " + record.id() + " has no name");
        }
        if (record.size() < 0) {
            throw new DecodeException("Item " + record.id() + " has negative size: " + record.size());
        }
        ItemStatus status = ItemStatus.fromValue(record.status())
                .orElseThrow(() -> new DecodeException(
                    "Item " + record.id() + " has unknown status: " + record.status()));
        
        int progress = switch (status) {
            case PROCESSING -> decodeProgress(record);
            case COMPLETED -> 100;
            case QUEUED, FAILED -> 0;
        };
        String error = status == ItemStatus.FAILED ? record.errorMessage() : null;
        
        return new ItemProgress(record.id(), record.name(), record.size(), status, progress, error);
    }
    
    private static int decodeProgress(BatchItemRecord record) {
        Integer raw = record.progress();
        if (raw == null) {
            return 0;
        }
        if (raw < 0 || raw > 100) {
            throw new DecodeException("Item " + record.id() + " has progress out of range: " + raw);
        }
        return raw;
    }
}
