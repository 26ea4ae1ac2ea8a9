package com.eduhub.tenant;

/**
 * Thrown when a record's custom fields do not match the tenant's schema.
 */
public class InvalidCustomFieldException extends IllegalArgumentException {
    
    private final String field;
    
    public InvalidCustomFieldException(String field, String message) {
        super(message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
