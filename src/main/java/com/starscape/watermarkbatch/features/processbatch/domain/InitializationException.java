package com.starscape.watermarkbatch.features.processbatch.domain;

/**
 * A session could not load its batch. The session never started.
 */
public class InitializationException extends RuntimeException {
    
    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
