package com.eduhub.directory;

import com.eduhub.domain.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Tenant directory held in process memory.
 * 
 * Used for local development and tests. Registration and updates are
 * serialized on a single lock so identifier claims are race-free;
 * lookups read the maps directly and always see the latest committed write.
 */
@Repository
@ConditionalOnProperty(name = "eduhub.directory.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryTenantDirectory extends AbstractTenantDirectory {
    
    private static final Logger log = LoggerFactory.getLogger(InMemoryTenantDirectory.class);
    
    private final Map<String, Tenant> tenantsById = new ConcurrentHashMap<>();
    private final Map<String, String> idsBySubdomain = new ConcurrentHashMap<>();
    private final Map<String, String> idsByDomain = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    
    @Override
    public Optional<Tenant> lookupBySubdomain(String subdomain) {
        String key = HostNames.normalize(subdomain);
        return key == null ? Optional.empty() : lookupByIdentifier(idsBySubdomain.get(key));
    }
    
    @Override
    public Optional<Tenant> lookupByCustomDomain(String domain) {
        String key = HostNames.normalize(domain);
        return key == null ? Optional.empty() : lookupByIdentifier(idsByDomain.get(key));
    }
    
    @Override
    public Optional<Tenant> lookupByIdentifier(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        Tenant tenant = tenantsById.get(tenantId);
        return tenant == null ? Optional.empty() : Optional.of(tenant.copy());
    }
    
    @Override
    public Tenant create(Tenant attributes) {
        Tenant tenant = prepareForCreate(attributes);
        
        synchronized (writeLock) {
            if (tenantsById.containsKey(tenant.getId())) {
                throw new DuplicateIdentifierException("id", tenant.getId());
            }
            if (idsBySubdomain.containsKey(tenant.getSubdomain())) {
                throw new DuplicateIdentifierException("subdomain", tenant.getSubdomain());
            }
            if (tenant.getCustomDomain() != null && idsByDomain.containsKey(tenant.getCustomDomain())) {
                throw new DuplicateIdentifierException("custom domain", tenant.getCustomDomain());
            }
            
            tenantsById.put(tenant.getId(), tenant);
            idsBySubdomain.put(tenant.getSubdomain(), tenant.getId());
            if (tenant.getCustomDomain() != null) {
                idsByDomain.put(tenant.getCustomDomain(), tenant.getId());
            }
        }
        
        log.info("Created tenant: id={}, subdomain={}, plan={}", tenant.getId(), tenant.getSubdomain(), tenant.getPlan());
        return tenant.copy();
    }
    
    @Override
    protected Tenant mutate(String tenantId, Consumer<Tenant> change) {
        requireTenantId(tenantId);
        
        synchronized (writeLock) {
            Tenant stored = tenantsById.get(tenantId);
            if (stored == null) {
                throw new TenantNotFoundException(tenantId);
            }
            Tenant updated = stored.copy();
            change.accept(updated);
            updated.touch();
            tenantsById.put(tenantId, updated);
            
            log.info("Updated tenant: id={}, status={}, plan={}", tenantId, updated.getStatus(), updated.getPlan());
            return updated.copy();
        }
    }
}
