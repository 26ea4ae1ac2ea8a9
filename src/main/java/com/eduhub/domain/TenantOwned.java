package com.eduhub.domain;

/**
 * A persisted entity partitioned by tenant.
 * 
 * The tenant identifier is set once, at creation, and never changes
 * afterwards. All reads and writes of tenant-owned records go through the
 * tenant guard in {@code com.eduhub.isolation}.
 */
public interface TenantOwned {
    
    /**
     * Logical field name of the tenant identifier, used in record queries.
     */
    String TENANT_FIELD = "tenantId";
    
    String getId();
    
    void setId(String id);
    
    String getTenantId();
    
    /**
     * Assign the owning tenant.
     * 
     * @param tenantId the tenant identifier
     * @throws IllegalStateException if a different tenant is already assigned
     */
    void setTenantId(String tenantId);
}
