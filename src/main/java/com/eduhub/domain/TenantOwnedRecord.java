package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for tenant-owned entities that carry a per-tenant
 * custom field extension map.
 */
public abstract class TenantOwnedRecord implements TenantOwned {
    
    @JsonProperty("id")
    private String id;
    
    @JsonProperty("tenantId")
    private String tenantId;
    
    /**
     * Extra attributes defined by the tenant's custom field schema
     */
    @JsonProperty("customFields")
    private Map<String, Object> customFields = new LinkedHashMap<>();
    
    @Override
    public String getId() {
        return id;
    }
    
    @Override
    public void setId(String id) {
        this.id = id;
    }
    
    @Override
    public String getTenantId() {
        return tenantId;
    }
    
    @Override
    public void setTenantId(String tenantId) {
        if (this.tenantId != null && !Objects.equals(this.tenantId, tenantId)) {
            throw new IllegalStateException(
                "Tenant of record " + id + " is already assigned and cannot change");
        }
        this.tenantId = tenantId;
    }
    
    public Map<String, Object> getCustomFields() {
        return customFields;
    }
    
    public void setCustomFields(Map<String, Object> customFields) {
        this.customFields = customFields != null ? new LinkedHashMap<>(customFields) : new LinkedHashMap<>();
    }
}
