package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumMap;
import java.util.Map;

/**
 * Subscription plan of a tenant and the resource quotas it grants.
 * 
 * Quotas are read from the plan every time a check runs, so an upgrade
 * takes effect on the next accounted operation.
 */
public enum PlanTier {
    
    BASIC("basic", 100L, 1L << 30, 25L, 500L),
    PREMIUM("premium", 10_000L, 50L << 30, 250L, 5_000L),
    ENTERPRISE("enterprise", 100_000L, 500L << 30, Long.MAX_VALUE, Long.MAX_VALUE);
    
    private final String value;
    private final Map<ResourceKind, Long> quotas;
    
    PlanTier(String value, long apiCallsPerDay, long storageBytes, long users, long students) {
        this.value = value;
        this.quotas = new EnumMap<>(ResourceKind.class);
        this.quotas.put(ResourceKind.API_CALLS, apiCallsPerDay);
        this.quotas.put(ResourceKind.STORAGE_BYTES, storageBytes);
        this.quotas.put(ResourceKind.USERS, users);
        this.quotas.put(ResourceKind.STUDENTS, students);
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Get the quota this plan grants for a resource kind.
     * 
     * @param kind the resource kind
     * @return the limit, {@link Long#MAX_VALUE} when unlimited
     */
    public long quotaFor(ResourceKind kind) {
        return quotas.get(kind);
    }
    
    @JsonCreator
    public static PlanTier fromValue(String value) {
        for (PlanTier tier : PlanTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown plan tier: " + value);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
