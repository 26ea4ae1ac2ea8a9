package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an institution on the platform.
 * 
 * Status transitions are driven by the billing system. A tenant is never
 * hard-deleted; cancellation moves it to {@link #INACTIVE}.
 */
public enum TenantStatus {
    
    /**
     * Newly registered institution in its evaluation period.
     * Full access with plan quotas.
     */
    TRIAL("trial"),
    
    /**
     * Paying institution in good standing.
     */
    ACTIVE("active"),
    
    /**
     * Access is allowed but quotas are reduced, e.g. after a failed payment.
     */
    LIMITED("limited"),
    
    /**
     * Cancelled or expired. No requests are served for this tenant.
     */
    INACTIVE("inactive");
    
    private final String value;
    
    TenantStatus(String value) {
        this.value = value;
    }
    
    /**
     * Get the string value of the status
     * 
     * @return String representation of the status
     */
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Parse a string value to TenantStatus enum
     * 
     * @param value String value to parse
     * @return TenantStatus enum value
     * @throws IllegalArgumentException if value is not recognized
     */
    @JsonCreator
    public static TenantStatus fromValue(String value) {
        for (TenantStatus status : TenantStatus.values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown tenant status: " + value);
    }
    
    /**
     * Check if requests may be served for a tenant in this status
     * 
     * @return true unless the tenant is inactive
     */
    public boolean allowsAccess() {
        return this != INACTIVE;
    }
    
    /**
     * Check if quotas are reduced in this status
     * 
     * @return true if the tenant is limited
     */
    public boolean isRestricted() {
        return this == LIMITED;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
