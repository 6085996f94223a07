package com.starscape.watermarkbatch.features.batches.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of documents submitted together for watermarking.
 * The row is shared with the watermarking backend, which moves status forward
 * and maintains the processed/failed counters.
 */
@Entity
@Table(name = "batches")
public class Batch {
    
    @Id
    @Column(name = "batch_id")
    private String batchId;
    
    @Column(name = "batch_name", nullable = false)
    private String batchName;
    
    @Column(nullable = false)
    private String mode;
    
    @Column(nullable = false)
    private String status;
    
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "watermark_settings", columnDefinition = "jsonb", nullable = false)
    private String watermarkSettingsJson;
    
    @Column(name = "total_files", nullable = false)
    private int totalFiles;
    
    @Column(name = "processed_files", nullable = false)
    private int processedFiles = 0;
    
    @Column(name = "failed_files", nullable = false)
    private int failedFiles = 0;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
    
    @OneToMany(mappedBy = "batch", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<BatchItem> items = new ArrayList<>();
    
    protected Batch() {
        // JPA constructor
    }
    
    public Batch(String batchId, String batchName, BatchMode mode, String watermarkSettingsJson) {
        this.batchId = batchId;
        this.batchName = batchName;
        this.mode = mode.value();
        this.watermarkSettingsJson = watermarkSettingsJson;
        this.status = BatchStatus.PENDING.value();
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    public String getBatchId() {
        return batchId;
    }
    
    public String getBatchName() {
        return batchName;
    }
    
    public String getMode() {
        return mode;
    }
    
    public String getStatus() {
        return status;
    }
    
    public String getWatermarkSettingsJson() {
        return watermarkSettingsJson;
    }
    
    public int getTotalFiles() {
        return totalFiles;
    }
    
    public int getProcessedFiles() {
        return processedFiles;
    }
    
    public int getFailedFiles() {
        return failedFiles;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    public Instant getCompletedAt() {
        return completedAt;
    }
    
    public List<BatchItem> getItems() {
        return Collections.unmodifiableList(items);
    }
    
    public void addItem(BatchItem item) {
        items.add(item);
        item.setBatch(this);
        this.totalFiles = items.size();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
