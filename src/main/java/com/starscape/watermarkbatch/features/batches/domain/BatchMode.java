package com.starscape.watermarkbatch.features.batches.domain;

/**
 * How the batch was submitted. SINGLE is a batch of exactly one document;
 * the distinction only changes how results are presented.
 */
public enum BatchMode {
    BATCH("batch"),
    SINGLE("single");
    
    private final String value;
    
    BatchMode(String value) {
        this.value = value;
    }
    
    public String value() {
        return value;
    }
    
    /**
     * Unknown or missing values fall back to BATCH.
     */
    public static BatchMode fromValue(String raw) {
        if (raw != null && SINGLE.value.equalsIgnoreCase(raw.trim())) {
            return SINGLE;
        }
        return BATCH;
    }
}
