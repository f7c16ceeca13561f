package com.corvus.core.exception;

/**
 * Base exception for engine programming and state errors.
 * Operation failures use the checked {@link OperationException} instead.
 */
public class CorvusException extends RuntimeException {
    
    private final String errorCode;
    
    public CorvusException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public CorvusException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
