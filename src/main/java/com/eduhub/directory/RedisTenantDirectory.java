package com.eduhub.directory;

import com.eduhub.domain.Tenant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Tenant directory backed by Redis.
 *
 * Key layout:
 * - {@code tenant:<id>} holds the tenant as JSON (no TTL, tenants are never deleted)
 * - {@code tenant:subdomain:<subdomain>} maps a subdomain to a tenant id
 * - {@code tenant:domain:<host>} maps a custom domain to a tenant id
 *
 * Identifier claims are taken with SETNX, so two registrations racing for
 * the same subdomain cannot both succeed. Claims taken before a failing one
 * are released again.
 *
 * Updates read the record, apply the change and write it back with a
 * compare-and-set script; a concurrent writer makes the script fail and the
 * update is retried on the fresh value.
 *
 * Every lookup goes to Redis. Nothing is cached locally.
 */
@Repository
@ConditionalOnProperty(name = "eduhub.directory.store", havingValue = "redis")
public class RedisTenantDirectory extends AbstractTenantDirectory {
    
    private static final Logger log = LoggerFactory.getLogger(RedisTenantDirectory.class);
    
    static final String KEY_PREFIX = "tenant:";
    static final String SUBDOMAIN_PREFIX = "tenant:subdomain:";
    static final String DOMAIN_PREFIX = "tenant:domain:";
    
    static final int MAX_UPDATE_ATTEMPTS = 5;
    
    // Replace the value only if nobody changed it since it was read
    private static final String COMPARE_AND_SET_SCRIPT = """
        local current = redis.call('GET', KEYS[1])
        if current == ARGV[1] then
            redis.call('SET', KEYS[1], ARGV[2])
            return 1
        end
        return 0
    """;
    
    private static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(COMPARE_AND_SET_SCRIPT, Long.class);
    
    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    
    public RedisTenantDirectory(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }
    
    @Override
    public Optional<Tenant> lookupBySubdomain(String subdomain) {
        String normalized = HostNames.normalize(subdomain);
        if (normalized == null) {
            return Optional.empty();
        }
        return resolveClaim(SUBDOMAIN_PREFIX + normalized);
    }
    
    @Override
    public Optional<Tenant> lookupByCustomDomain(String domain) {
        String normalized = HostNames.normalize(domain);
        if (normalized == null) {
            return Optional.empty();
        }
        return resolveClaim(DOMAIN_PREFIX + normalized);
    }
    
    @Override
    public Optional<Tenant> lookupByIdentifier(String tenantId) {
        if (tenantId == null || tenantId.trim().isEmpty()) {
            return Optional.empty();
        }
        
        String json = redisTemplate.opsForValue().get(KEY_PREFIX + tenantId);
        if (json == null) {
            log.debug("Tenant not found: {}", tenantId);
            return Optional.empty();
        }
        return Optional.of(deserialize(json));
    }
    
    @Override
    public Tenant create(Tenant attributes) {
        Tenant tenant = prepareForCreate(attributes);
        String json = serialize(tenant);
        
        List<String> claimed = new ArrayList<>();
        try {
            claim(SUBDOMAIN_PREFIX + tenant.getSubdomain(), tenant.getId(), "subdomain", tenant.getSubdomain(), claimed);
            if (tenant.getCustomDomain() != null) {
                claim(DOMAIN_PREFIX + tenant.getCustomDomain(), tenant.getId(), "custom domain",
                    tenant.getCustomDomain(), claimed);
            }
            claim(KEY_PREFIX + tenant.getId(), json, "id", tenant.getId(), claimed);
        } catch (DuplicateIdentifierException e) {
            release(claimed);
            throw e;
        }
        
        log.info("Created tenant: id={}, subdomain={}, plan={}", tenant.getId(), tenant.getSubdomain(), tenant.getPlan());
        return tenant;
    }
    
    @Override
    protected Tenant mutate(String tenantId, Consumer<Tenant> change) {
        requireTenantId(tenantId);
        String key = KEY_PREFIX + tenantId;
        
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            String current = redisTemplate.opsForValue().get(key);
            if (current == null) {
                throw new TenantNotFoundException(tenantId);
            }
            
            Tenant tenant = deserialize(current);
            change.accept(tenant);
            tenant.touch();
            String updated = serialize(tenant);
            
            Long swapped = redisTemplate.execute(COMPARE_AND_SET, Collections.singletonList(key), current, updated);
            if (swapped != null && swapped == 1L) {
                log.info("Updated tenant: id={}, status={}, plan={}", tenantId, tenant.getStatus(), tenant.getPlan());
                return tenant;
            }
            log.debug("Concurrent update of tenant {} detected, retrying (attempt {})", tenantId, attempt);
        }
        
        throw new TenantDirectoryException(
            "Tenant " + tenantId + " is being modified concurrently; gave up after " + MAX_UPDATE_ATTEMPTS + " attempts");
    }
    
    private Optional<Tenant> resolveClaim(String claimKey) {
        String tenantId = redisTemplate.opsForValue().get(claimKey);
        if (tenantId == null) {
            log.debug("No tenant claims {}", claimKey);
            return Optional.empty();
        }
        return lookupByIdentifier(tenantId);
    }
    
    private void claim(String key, String value, String identifierType, String identifier, List<String> claimed) {
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, value);
        if (!Boolean.TRUE.equals(acquired)) {
            log.warn("Tenant registration rejected: {} '{}' already claimed", identifierType, identifier);
            throw new DuplicateIdentifierException(identifierType, identifier);
        }
        claimed.add(key);
    }
    
    private void release(List<String> claimed) {
        if (!claimed.isEmpty()) {
            redisTemplate.delete(claimed);
        }
    }
    
    private String serialize(Tenant tenant) {
        try {
            return objectMapper.writeValueAsString(tenant);
        } catch (JsonProcessingException e) {
            throw new TenantDirectoryException("Failed to serialize tenant " + tenant.getId(), e);
        }
    }
    
    private Tenant deserialize(String json) {
        try {
            return objectMapper.readValue(json, Tenant.class);
        } catch (JsonProcessingException e) {
            throw new TenantDirectoryException("Failed to read tenant record", e);
        }
    }
}
