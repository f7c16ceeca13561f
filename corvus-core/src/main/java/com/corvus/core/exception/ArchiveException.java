package com.corvus.core.exception;

/**
 * Thrown when an archive cannot be built. Any traversal or write error aborts the whole archive.
 */
public class ArchiveException extends OperationException {
    
    public static final String ERROR_CODE = "ARCHIVE_FAILED";
    
    public ArchiveException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ArchiveException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
    
    protected ArchiveException(String errorCode, String message) {
        super(errorCode, message);
    }
}
