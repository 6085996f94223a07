package com.starscape.watermarkbatch.features.batches.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Batch lifecycle as persisted in the batches table.
 * COMPLETED and FAILED are terminal: once written they never change.
 */
public enum BatchStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");
    
    private final String value;
    
    BatchStatus(String value) {
        this.value = value;
    }
    
    public String value() {
        return value;
    }
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    public static Optional<BatchStatus> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }
}
