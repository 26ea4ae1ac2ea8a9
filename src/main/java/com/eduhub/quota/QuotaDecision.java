package com.eduhub.quota;

import com.eduhub.domain.ResourceKind;

/**
 * Result of a quota check.
 */
public final class QuotaDecision {
    
    private final boolean allowed;
    private final ResourceKind kind;
    private final long current;
    private final long limit;
    
    private QuotaDecision(boolean allowed, ResourceKind kind, long current, long limit) {
        this.allowed = allowed;
        this.kind = kind;
        this.current = current;
        this.limit = limit;
    }
    
    public static QuotaDecision allowed(ResourceKind kind, long current, long limit) {
        return new QuotaDecision(true, kind, current, limit);
    }
    
    public static QuotaDecision exceeded(ResourceKind kind, long limit, long current) {
        return new QuotaDecision(false, kind, current, limit);
    }
    
    public boolean isAllowed() {
        return allowed;
    }
    
    public ResourceKind getKind() {
        return kind;
    }
    
    /**
     * @return usage after the increment when allowed, usage left untouched when exceeded
     */
    public long getCurrent() {
        return current;
    }
    
    public long getLimit() {
        return limit;
    }
    
    public long getRemaining() {
        return Math.max(0L, limit - current);
    }
    
    @Override
    public String toString() {
        return "QuotaDecision{" +
                "allowed=" + allowed +
                ", kind=" + kind +
                ", current=" + current +
                ", limit=" + limit +
                '}';
    }
}
