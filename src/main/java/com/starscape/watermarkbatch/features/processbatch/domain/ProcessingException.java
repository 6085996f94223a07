package com.starscape.watermarkbatch.features.processbatch.domain;

/**
 * The backend processing call failed. Fatal to the session; never retried automatically.
 */
public class ProcessingException extends RuntimeException {
    
    public ProcessingException(String message) {
        super(message);
    }
    
    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
