package com.eduhub.security;

/**
 * Thrown when a request to a tenant-scoped route carries no signal that
 * resolves to a tenant. Surfaced to the client as a bad request.
 */
public class TenantNotIdentifiedException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    public TenantNotIdentifiedException(String message) {
        super(message);
    }
}
