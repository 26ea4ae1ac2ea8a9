package com.eduhub.isolation;

import com.eduhub.security.TenantIsolationException;

/**
 * Thrown when a write names a tenant other than the one bound to the
 * current unit of work. The record is not persisted.
 */
public class CrossTenantWriteException extends TenantIsolationException {
    
    private static final long serialVersionUID = 1L;
    
    private final String contextTenantId;
    private final String recordTenantId;
    
    public CrossTenantWriteException(String contextTenantId, String recordTenantId, String recordType) {
        super(String.format("Cross-tenant write blocked: tenant '%s' attempted to write %s owned by tenant '%s'",
            contextTenantId, recordType, recordTenantId));
        this.contextTenantId = contextTenantId;
        this.recordTenantId = recordTenantId;
    }
    
    public String getContextTenantId() {
        return contextTenantId;
    }
    
    public String getRecordTenantId() {
        return recordTenantId;
    }
}
