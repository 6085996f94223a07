package com.starscape.watermarkbatch.features.batches.domain;

/**
 * Raw batch row as handed out by the {@link BatchStore}. Status and mode are
 * undecoded text; settings are passed through untouched.
 */
public record BatchRecord(
    String id,
    String status,
    String settings,
    String mode,
    String name,
    int totalFiles
) {}
