package com.eduhub.directory;

import com.eduhub.domain.PlanTier;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Authoritative registry of tenants and their external identifiers.
 * 
 * Implementations must never serve lookups from a cache: a status change
 * that gates access (e.g. cancellation) is visible to the next lookup.
 * 
 * Subdomains and custom domains are case-insensitive and are normalized
 * with {@link HostNames#normalize(String)} before storage and lookup.
 * 
 * The billing system is the sole caller of the update operations.
 */
public interface TenantDirectory {
    
    /**
     * Find the tenant owning a subdomain.
     * 
     * @param subdomain the subdomain label, e.g. "acme"
     * @return the tenant, or empty if no tenant owns the subdomain
     */
    Optional<Tenant> lookupBySubdomain(String subdomain);
    
    /**
     * Find the tenant owning a custom domain.
     * 
     * @param domain the full host name, e.g. "portal.acme.edu"
     * @return the tenant, or empty if no tenant owns the domain
     */
    Optional<Tenant> lookupByCustomDomain(String domain);
    
    /**
     * Find a tenant by its internal identifier.
     * 
     * @param tenantId the internal identifier
     * @return the tenant, or empty if unknown
     */
    Optional<Tenant> lookupByIdentifier(String tenantId);
    
    /**
     * Register a new tenant.
     * 
     * An identifier is generated when the given tenant has none.
     * 
     * @param attributes the tenant attributes; subdomain and name are required
     * @return the stored tenant
     * @throws DuplicateIdentifierException if the subdomain, custom domain or id is already claimed
     * @throws IllegalArgumentException if a required attribute is missing
     */
    Tenant create(Tenant attributes);
    
    /**
     * @throws TenantNotFoundException if the tenant does not exist
     */
    Tenant updateStatus(String tenantId, TenantStatus status);
    
    /**
     * @throws TenantNotFoundException if the tenant does not exist
     */
    Tenant updatePlan(String tenantId, PlanTier plan);
    
    /**
     * Merge a partial configuration into the tenant's config.
     * 
     * New keys overwrite, unspecified keys are preserved, and a key mapped
     * to {@code null} is removed.
     * 
     * @throws TenantNotFoundException if the tenant does not exist
     */
    Tenant updateConfig(String tenantId, Map<String, Object> partialConfig);
}
