package com.starscape.watermarkbatch.features.processbatch.api.dto;

public record PauseBatchResponse(
    String batchId,
    boolean paused,
    String message
) {}
