package com.eduhub.directory;

/**
 * Thrown when the directory's backing store cannot complete an operation.
 */
public class TenantDirectoryException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public TenantDirectoryException(String message) {
        super(message);
    }
    
    public TenantDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
