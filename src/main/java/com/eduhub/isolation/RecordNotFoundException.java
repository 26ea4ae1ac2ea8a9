package com.eduhub.isolation;

/**
 * Thrown when a record does not exist within the current tenant.
 */
public class RecordNotFoundException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public RecordNotFoundException(String recordType, String id) {
        super(recordType + " not found: " + id);
    }
}
