package com.starscape.watermarkbatch.common.exception;

/**
 * Rule violation reported back to the client with a stable error code.
 */
public class BusinessException extends RuntimeException {
    
    private final String code;
    
    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
