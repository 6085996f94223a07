package com.starscape.watermarkbatch.features.trackprogress.domain;

/**
 * A single poll of the batch store failed or timed out. Recovered by skipping the tick.
 */
public class TransientFetchException extends RuntimeException {
    
    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
