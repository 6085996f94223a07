package com.starscape.watermarkbatch.features.trackprogress.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Per-document lifecycle. Transitions only move forward:
 * QUEUED -> PROCESSING -> {COMPLETED, FAILED}.
 */
public enum ItemStatus {
    QUEUED("queued", 0),
    PROCESSING("processing", 1),
    COMPLETED("completed", 2),
    FAILED("failed", 2);
    
    private final String value;
    private final int rank;
    
    ItemStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }
    
    public String value() {
        return value;
    }
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
    
    public boolean canTransitionTo(ItemStatus next) {
        if (next == this) {
            return true;
        }
        return !isTerminal() && next.rank > rank;
    }
    
    public static Optional<ItemStatus> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }
}
