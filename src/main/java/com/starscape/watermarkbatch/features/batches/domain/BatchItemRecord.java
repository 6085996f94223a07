package com.starscape.watermarkbatch.features.batches.domain;

/**
 * Raw item row as handed out by the {@link BatchStore}.
 */
public record BatchItemRecord(
    String id,
    String name,
    long size,
    String status,
    Integer progress,
    String errorMessage
) {}
