package com.starscape.watermarkbatch.features.processbatch.api.dto;

public record CancelBatchResponse(
    String batchId,
    boolean cancelled,
    String state
) {}
