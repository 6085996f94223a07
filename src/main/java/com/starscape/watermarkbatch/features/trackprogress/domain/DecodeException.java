package com.starscape.watermarkbatch.features.trackprogress.domain;

/**
 * A stored batch or item row could not be mapped onto the typed lifecycle model.
 */
public class DecodeException extends RuntimeException {
    
    public DecodeException(String message) {
        super(message);
    }
}
