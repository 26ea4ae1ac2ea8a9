package com.eduhub.isolation;

import com.eduhub.security.TenantIsolationException;

/**
 * Thrown when a read names, or would return, data of a tenant other than
 * the one bound to the current unit of work.
 */
public class CrossTenantReadException extends TenantIsolationException {
    
    private static final long serialVersionUID = 1L;
    
    private final String contextTenantId;
    private final String requestedTenantId;
    
    public CrossTenantReadException(String contextTenantId, String requestedTenantId, String recordType) {
        super(String.format("Cross-tenant read blocked: tenant '%s' attempted to read %s of tenant '%s'",
            contextTenantId, recordType, requestedTenantId));
        this.contextTenantId = contextTenantId;
        this.requestedTenantId = requestedTenantId;
    }
    
    public String getContextTenantId() {
        return contextTenantId;
    }
    
    public String getRequestedTenantId() {
        return requestedTenantId;
    }
}
