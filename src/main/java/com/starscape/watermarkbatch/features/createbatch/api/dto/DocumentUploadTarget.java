package com.starscape.watermarkbatch.features.createbatch.api.dto;

public record DocumentUploadTarget(
    String itemId,
    String filename,
    String method,
    String presignedUrl,
    String objectKey
) {}
