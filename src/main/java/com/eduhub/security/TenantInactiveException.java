package com.eduhub.security;

/**
 * Thrown when a request resolves to an inactive tenant.
 * 
 * Rendered as a plain not-found so that the existence of the tenant is not
 * disclosed.
 */
public class TenantInactiveException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final String tenantId;
    
    public TenantInactiveException(String tenantId) {
        super("Tenant is inactive: " + tenantId);
        this.tenantId = tenantId;
    }
    
    public String getTenantId() {
        return tenantId;
    }
}
