package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents one institution using the shared platform.
 *
 * The internal identifier is an opaque UUID string assigned at registration
 * and never changes. The subdomain and the optional custom domain are the
 * external identifiers used to route requests; each is owned by exactly one
 * tenant at a time.
 *
 * Tenants are stored by the tenant directory and are never hard-deleted.
 */
public class Tenant {
    
    @JsonProperty("id")
    private String id;
    
    @JsonProperty("subdomain")
    private String subdomain;
    
    /**
     * Optional fully qualified host, e.g. "portal.springfield-high.edu"
     */
    @JsonProperty("custom_domain")
    private String customDomain;
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("status")
    private TenantStatus status;
    
    @JsonProperty("plan")
    private PlanTier plan;
    
    /**
     * Branding, feature flags and custom field schemas.
     * Merged key by key on update.
     */
    @JsonProperty("config")
    private Map<String, Object> config;
    
    @JsonProperty("created_at")
    private Instant createdAt;
    
    @JsonProperty("updated_at")
    private Instant updatedAt;
    
    /**
     * Default constructor
     */
    public Tenant() {
        this.config = new HashMap<>();
        this.status = TenantStatus.TRIAL;
        this.plan = PlanTier.BASIC;
    }
    
    /**
     * Builder pattern for creating Tenant instances
     */
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private final Tenant tenant;
        
        public Builder() {
            this.tenant = new Tenant();
        }
        
        public Builder id(String id) {
            tenant.id = id;
            return this;
        }
        
        public Builder subdomain(String subdomain) {
            tenant.subdomain = subdomain;
            return this;
        }
        
        public Builder customDomain(String customDomain) {
            tenant.customDomain = customDomain;
            return this;
        }
        
        public Builder name(String name) {
            tenant.name = name;
            return this;
        }
        
        public Builder status(TenantStatus status) {
            tenant.status = status;
            return this;
        }
        
        public Builder plan(PlanTier plan) {
            tenant.plan = plan;
            return this;
        }
        
        public Builder config(Map<String, Object> config) {
            tenant.config = config != null ? new HashMap<>(config) : new HashMap<>();
            return this;
        }
        
        public Builder createdAt(Instant createdAt) {
            tenant.createdAt = createdAt;
            return this;
        }
        
        public Builder updatedAt(Instant updatedAt) {
            tenant.updatedAt = updatedAt;
            return this;
        }
        
        public Tenant build() {
            if (tenant.createdAt == null) {
                tenant.createdAt = Instant.now();
            }
            if (tenant.updatedAt == null) {
                tenant.updatedAt = tenant.createdAt;
            }
            return tenant;
        }
    }
    
    /**
     * Create a detached copy, so callers cannot mutate a stored instance.
     *
     * @return a new Tenant with the same attributes and a copied config map
     */
    public Tenant copy() {
        return Tenant.builder()
            .id(id)
            .subdomain(subdomain)
            .customDomain(customDomain)
            .name(name)
            .status(status)
            .plan(plan)
            .config(config)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }
    
    // Getters and Setters
    
    public String getId() {
        return id;
    }
    
    public void setId(String id) {
        this.id = id;
    }
    
    public String getSubdomain() {
        return subdomain;
    }
    
    public void setSubdomain(String subdomain) {
        this.subdomain = subdomain;
    }
    
    public String getCustomDomain() {
        return customDomain;
    }
    
    public void setCustomDomain(String customDomain) {
        this.customDomain = customDomain;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public TenantStatus getStatus() {
        return status;
    }
    
    public void setStatus(TenantStatus status) {
        this.status = status;
    }
    
    public PlanTier getPlan() {
        return plan;
    }
    
    public void setPlan(PlanTier plan) {
        this.plan = plan;
    }
    
    public Map<String, Object> getConfig() {
        return config;
    }
    
    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
    
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
    
    /**
     * Check if requests may be served for this tenant
     *
     * @return true unless the tenant is inactive
     */
    @JsonIgnore
    public boolean isAccessible() {
        return status != null && status.allowsAccess();
    }
    
    /**
     * Update the updatedAt timestamp to current time
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String toString() {
        return "Tenant{" +
                "id='" + id + '\'' +
                ", subdomain='" + subdomain + '\'' +
                ", customDomain='" + customDomain + '\'' +
                ", name='" + name + '\'' +
                ", status=" + status +
                ", plan=" + plan +
                '}';
    }
}
