package com.eduhub.directory;

import com.eduhub.domain.PlanTier;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Shared validation and update plumbing for tenant directory implementations.
 * 
 * Subclasses provide storage of a prepared tenant and an atomic
 * read-modify-write of a single tenant record.
 */
public abstract class AbstractTenantDirectory implements TenantDirectory {
    
    @Override
    public Tenant updateStatus(String tenantId, TenantStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return mutate(tenantId, tenant -> tenant.setStatus(status));
    }
    
    @Override
    public Tenant updatePlan(String tenantId, PlanTier plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        return mutate(tenantId, tenant -> tenant.setPlan(plan));
    }
    
    @Override
    public Tenant updateConfig(String tenantId, Map<String, Object> partialConfig) {
        return mutate(tenantId,
            tenant -> tenant.setConfig(TenantConfigMerger.merge(tenant.getConfig(), partialConfig)));
    }
    
    /**
     * Apply a change to the stored tenant atomically.
     * 
     * @param tenantId the tenant to change
     * @param change mutation applied to a detached copy
     * @return the stored result
     * @throws TenantNotFoundException if the tenant does not exist
     */
    protected abstract Tenant mutate(String tenantId, Consumer<Tenant> change);
    
    /**
     * Validate registration attributes and build the tenant to store.
     * 
     * @param attributes the caller's attributes
     * @return a detached, normalized tenant with an identifier assigned
     */
    protected Tenant prepareForCreate(Tenant attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("Tenant must not be null");
        }
        String subdomain = HostNames.normalize(attributes.getSubdomain());
        if (subdomain == null) {
            throw new IllegalArgumentException("Tenant subdomain must not be null or empty");
        }
        if (attributes.getName() == null || attributes.getName().trim().isEmpty()) {
            throw new IllegalArgumentException("Tenant name must not be null or empty");
        }
        
        Instant now = Instant.now();
        return Tenant.builder()
            .id(attributes.getId() != null ? attributes.getId().trim() : UUID.randomUUID().toString())
            .subdomain(subdomain)
            .customDomain(HostNames.normalize(attributes.getCustomDomain()))
            .name(attributes.getName().trim())
            .status(attributes.getStatus() != null ? attributes.getStatus() : TenantStatus.TRIAL)
            .plan(attributes.getPlan() != null ? attributes.getPlan() : PlanTier.BASIC)
            .config(attributes.getConfig())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }
    
    protected static void requireTenantId(String tenantId) {
        if (tenantId == null || tenantId.trim().isEmpty()) {
            throw new IllegalArgumentException("Tenant ID must not be null or empty");
        }
    }
}
