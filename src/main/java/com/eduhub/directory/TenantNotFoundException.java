package com.eduhub.directory;

/**
 * Thrown when an update names a tenant the directory does not know.
 */
public class TenantNotFoundException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final String tenantId;
    
    public TenantNotFoundException(String tenantId) {
        super("Tenant not found: " + tenantId);
        this.tenantId = tenantId;
    }
    
    public String getTenantId() {
        return tenantId;
    }
}
