package com.eduhub.security;

/**
 * Base class of tenant isolation violations.
 * 
 * A violation always indicates a bug in application code. It is fatal for
 * the unit of work, is never auto-corrected and must not be caught and
 * ignored above the data access layer.
 */
public abstract class TenantIsolationException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    protected TenantIsolationException(String message) {
        super(message);
    }
}
