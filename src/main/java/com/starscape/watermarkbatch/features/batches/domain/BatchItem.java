package com.starscape.watermarkbatch.features.batches.domain;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One document within a batch. Status, progress and error are written by the
 * watermarking backend as raw text and are decoded by the reader side.
 */
@Entity
@Table(name = "batch_items")
public class BatchItem {
    
    public static final String INITIAL_STATUS = "queued";
    
    @Id
    @Column(name = "item_id")
    private String itemId;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_id", nullable = false)
    private Batch batch;
    
    @Column(name = "batch_id", insertable = false, updatable = false)
    private String batchId;
    
    @Column(name = "original_name", nullable = false)
    private String originalName;
    
    @Column(name = "mime_type", nullable = false)
    private String mimeType;
    
    @Column(name = "file_size", nullable = false)
    private long fileSize;
    
    @Column(name = "object_key")
    private String objectKey;
    
    @Column(nullable = false)
    private String status;
    
    @Column
    private Integer progress;
    
    @Column(name = "error_message")
    private String errorMessage;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "processed_at")
    private Instant processedAt;
    
    protected BatchItem() {
        // JPA constructor
    }
    
    public BatchItem(String itemId, String originalName, String mimeType, long fileSize, String objectKey) {
        this.itemId = itemId;
        this.originalName = originalName;
        this.mimeType = mimeType;
        this.fileSize = fileSize;
        this.objectKey = objectKey;
        this.status = INITIAL_STATUS;
        this.progress = 0;
        this.createdAt = Instant.now();
    }
    
    public String getItemId() {
        return itemId;
    }
    
    public String getBatchId() {
        return batchId != null ? batchId : (batch != null ? batch.getBatchId() : null);
    }
    
    public String getOriginalName() {
        return originalName;
    }
    
    public String getMimeType() {
        return mimeType;
    }
    
    public long getFileSize() {
        return fileSize;
    }
    
    public String getObjectKey() {
        return objectKey;
    }
    
    public String getStatus() {
        return status;
    }
    
    public Integer getProgress() {
        return progress;
    }
    
    public String getErrorMessage() {
        return errorMessage;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getProcessedAt() {
        return processedAt;
    }
    
    void setBatch(Batch batch) {
        this.batch = batch;
    }
}
