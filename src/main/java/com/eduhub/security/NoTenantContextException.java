package com.eduhub.security;

/**
 * Thrown when a tenant-scoped operation runs outside any resolved tenant
 * context. There is no default tenant to fall back to.
 */
public class NoTenantContextException extends TenantIsolationException {
    
    private static final long serialVersionUID = 1L;
    
    public NoTenantContextException() {
        super("No tenant context bound to the current unit of work");
    }
    
    public NoTenantContextException(String operation) {
        super("No tenant context bound to the current unit of work for operation: " + operation);
    }
}
