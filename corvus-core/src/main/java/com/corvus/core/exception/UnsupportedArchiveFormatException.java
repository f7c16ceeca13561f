package com.corvus.core.exception;

/**
 * Thrown when an archive format tag is not one of {@code zip}, {@code tar} or {@code tar.gz}.
 */
public class UnsupportedArchiveFormatException extends ArchiveException {
    
    public static final String ERROR_CODE = "UNSUPPORTED_FORMAT";
    
    private final String format;
    
    public UnsupportedArchiveFormatException(String format) {
        super(ERROR_CODE, "Unsupported archive format: " + format);
        this.format = format;
    }
    
    public String getFormat() {
        return format;
    }
}
