package com.eduhub.quota;

import com.eduhub.domain.ResourceKind;

/**
 * Thrown when an operation would take a tenant past a plan quota.
 */
public class QuotaExceededException extends RuntimeException {
    
    private final String tenantId;
    private final ResourceKind kind;
    private final long limit;
    private final long current;
    private final Long retryAfterSeconds;
    
    public QuotaExceededException(String tenantId, ResourceKind kind, long limit, long current, Long retryAfterSeconds) {
        super("Quota exceeded for " + kind + ": " + current + " of " + limit + " used");
        this.tenantId = tenantId;
        this.kind = kind;
        this.limit = limit;
        this.current = current;
        this.retryAfterSeconds = retryAfterSeconds;
    }
    
    public String getTenantId() {
        return tenantId;
    }
    
    public ResourceKind getKind() {
        return kind;
    }
    
    public long getLimit() {
        return limit;
    }
    
    public long getCurrent() {
        return current;
    }
    
    /**
     * @return seconds until the quota window resets, or null for cumulative resources
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
