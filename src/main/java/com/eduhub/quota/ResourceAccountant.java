package com.eduhub.quota;

import com.eduhub.directory.TenantDirectory;
import com.eduhub.directory.TenantNotFoundException;
import com.eduhub.domain.ResourceKind;
import com.eduhub.domain.Tenant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resource Accountant
 *
 * Tracks per-tenant consumption and enforces the quotas of the tenant's plan.
 *
 * - API calls are counted per UTC day; the counter expires with its day.
 * - Storage, users and students are cumulative and go down only through
 *   {@link #release}.
 * - The plan is read from the directory on every check, so plan changes
 *   apply to the next operation.
 * - A limited tenant gets a fraction of each finite quota
 *   ({@code eduhub.quota.limited-factor}).
 *
 * Usage is never rolled back when the work that consumed it is cancelled.
 */
@Service
public class ResourceAccountant {
    
    private static final Logger log = LoggerFactory.getLogger(ResourceAccountant.class);
    
    private final UsageCounterStore counterStore;
    private final TenantDirectory tenantDirectory;
    private final Clock clock;
    private final double limitedFactor;
    
    private final Map<ResourceKind, Counter> allowedCounters = new EnumMap<>(ResourceKind.class);
    private final Map<ResourceKind, Counter> exceededCounters = new EnumMap<>(ResourceKind.class);
    
    public ResourceAccountant(
        UsageCounterStore counterStore,
        TenantDirectory tenantDirectory,
        Clock clock,
        MeterRegistry meterRegistry,
        @Value("${eduhub.quota.limited-factor:0.5}") double limitedFactor
    ) {
        if (limitedFactor < 0.0 || limitedFactor > 1.0) {
            throw new IllegalArgumentException("eduhub.quota.limited-factor must be between 0 and 1: " + limitedFactor);
        }
        this.counterStore = counterStore;
        this.tenantDirectory = tenantDirectory;
        this.clock = clock;
        this.limitedFactor = limitedFactor;
        
        for (ResourceKind kind : ResourceKind.values()) {
            allowedCounters.put(kind, Counter.builder("eduhub.quota.allowed")
                .description("Resource increments accepted within quota")
                .tag("resource", kind.getValue())
                .register(meterRegistry));
            exceededCounters.put(kind, Counter.builder("eduhub.quota.exceeded")
                .description("Resource increments refused because the quota was reached")
                .tag("resource", kind.getValue())
                .register(meterRegistry));
        }
    }
    
    public QuotaDecision checkAndIncrement(String tenantId, ResourceKind kind) {
        return checkAndIncrement(tenantId, kind, 1L);
    }
    
    /**
     * Check the quota and record the consumption in one atomic step.
     *
     * @param tenantId the consuming tenant
     * @param kind the resource kind
     * @param amount units to consume, at least 1
     * @return the decision; a refused increment is not counted
     * @throws TenantNotFoundException if the tenant does not exist
     */
    public QuotaDecision checkAndIncrement(String tenantId, ResourceKind kind, long amount) {
        requirePositive(amount);
        Tenant tenant = tenant(tenantId);
        long limit = limitFor(tenant, kind);
        
        CounterUpdate update = counterStore.tryIncrement(key(tenantId, kind), amount, limit, windowEnd(kind));
        if (update.isApplied()) {
            allowedCounters.get(kind).increment();
            return QuotaDecision.allowed(kind, update.getValue(), limit);
        }
        
        exceededCounters.get(kind).increment();
        log.info("Tenant {} reached its {} quota ({} of {})", tenantId, kind, update.getValue(), limit);
        return QuotaDecision.exceeded(kind, limit, update.getValue());
    }
    
    /**
     * Like {@link #checkAndIncrement(String, ResourceKind, long)} but fails
     * instead of returning a refusal.
     *
     * @throws QuotaExceededException if the quota would be exceeded
     */
    public QuotaDecision requireWithinQuota(String tenantId, ResourceKind kind, long amount) {
        QuotaDecision decision = checkAndIncrement(tenantId, kind, amount);
        if (!decision.isAllowed()) {
            throw new QuotaExceededException(tenantId, kind, decision.getLimit(), decision.getCurrent(),
                kind.isWindowed() ? secondsUntilWindowEnd() : null);
        }
        return decision;
    }
    
    /**
     * Return units of a cumulative resource, e.g. after a student is deleted.
     *
     * @return usage after the release, never below zero
     */
    public long release(String tenantId, ResourceKind kind, long amount) {
        requirePositive(amount);
        if (kind.isWindowed()) {
            throw new IllegalArgumentException("Windowed resource " + kind + " cannot be released");
        }
        long remaining = counterStore.release(key(tenantId, kind), amount);
        log.debug("Released {} {} for tenant {}, usage now {}", amount, kind, tenantId, remaining);
        return remaining;
    }
    
    public long currentUsage(String tenantId, ResourceKind kind) {
        return counterStore.current(key(tenantId, kind));
    }
    
    /**
     * Summarize usage of every resource kind against the limits in force now.
     *
     * @throws TenantNotFoundException if the tenant does not exist
     */
    public UsageReport report(String tenantId) {
        Tenant tenant = tenant(tenantId);
        Map<ResourceKind, UsageReport.ResourceUsage> usage = new EnumMap<>(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.values()) {
            usage.put(kind, new UsageReport.ResourceUsage(
                currentUsage(tenantId, kind), limitFor(tenant, kind), windowEnd(kind)));
        }
        return new UsageReport(tenantId, tenant.getPlan(), tenant.getStatus(), clock.instant(), usage);
    }
    
    /**
     * The limit in force for a tenant, after the reduction for limited tenants.
     */
    long limitFor(Tenant tenant, ResourceKind kind) {
        long quota = tenant.getPlan().quotaFor(kind);
        if (quota == Long.MAX_VALUE || !tenant.getStatus().isRestricted()) {
            return quota;
        }
        return (long) Math.floor(quota * limitedFactor);
    }
    
    private Tenant tenant(String tenantId) {
        return tenantDirectory.lookupByIdentifier(tenantId)
            .orElseThrow(() -> new TenantNotFoundException(tenantId));
    }
    
    private String key(String tenantId, ResourceKind kind) {
        if (!kind.isWindowed()) {
            return tenantId + ":" + kind.getValue();
        }
        return tenantId + ":" + kind.getValue() + ":" + LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
    
    private Instant windowEnd(ResourceKind kind) {
        if (!kind.isWindowed()) {
            return null;
        }
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    
    private long secondsUntilWindowEnd() {
        Instant end = windowEnd(ResourceKind.API_CALLS);
        return Math.max(1L, Duration.between(clock.instant(), end).getSeconds());
    }
    
    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
