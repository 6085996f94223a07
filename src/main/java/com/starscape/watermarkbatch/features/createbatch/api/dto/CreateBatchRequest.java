package com.starscape.watermarkbatch.features.createbatch.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateBatchRequest(
    @Size(max = 255, message = "Batch name too long")
    String batchName,
    
    @Pattern(regexp = "^(batch|single)$", message = "Mode must be batch or single")
    String mode,
    
    @NotNull(message = "Watermark settings are required")
    @Valid
    WatermarkSettingsRequest settings,
    
    @NotEmpty(message = "Files list cannot be empty")
    @Size(max = 100, message = "Maximum 100 files per batch")
    @Valid
    List<DocumentUploadRequest> files
) {}
