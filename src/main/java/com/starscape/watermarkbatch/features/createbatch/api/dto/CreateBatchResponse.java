package com.starscape.watermarkbatch.features.createbatch.api.dto;

import java.util.List;

public record CreateBatchResponse(
    String batchId,
    String batchName,
    String mode,
    String status,
    List<DocumentUploadTarget> items
) {}
