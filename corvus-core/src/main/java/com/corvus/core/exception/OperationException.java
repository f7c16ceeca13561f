package com.corvus.core.exception;

/**
 * Exception thrown by an operation executor on failure.
 * The message becomes the task's failure reason, so it must be readable on its own.
 */
public class OperationException extends Exception {
    
    public static final String IO_ERROR = "IO_ERROR";
    
    private final String errorCode;
    
    public OperationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public OperationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
