package com.eduhub.quota;

import com.eduhub.domain.PlanTier;
import com.eduhub.domain.ResourceKind;
import com.eduhub.domain.TenantStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Usage of every resource kind against the limits in force for a tenant.
 */
public class UsageReport {
    
    @JsonProperty("tenant_id")
    private final String tenantId;
    
    @JsonProperty("plan")
    private final PlanTier plan;
    
    @JsonProperty("status")
    private final TenantStatus status;
    
    @JsonProperty("generated_at")
    private final Instant generatedAt;
    
    @JsonProperty("resources")
    private final Map<String, ResourceUsage> resources;
    
    public UsageReport(String tenantId, PlanTier plan, TenantStatus status, Instant generatedAt,
                       Map<ResourceKind, ResourceUsage> resources) {
        this.tenantId = tenantId;
        this.plan = plan;
        this.status = status;
        this.generatedAt = generatedAt;
        Map<String, ResourceUsage> byName = new LinkedHashMap<>();
        resources.forEach((kind, usage) -> byName.put(kind.getValue(), usage));
        this.resources = Collections.unmodifiableMap(byName);
    }
    
    public String getTenantId() {
        return tenantId;
    }
    
    public PlanTier getPlan() {
        return plan;
    }
    
    public TenantStatus getStatus() {
        return status;
    }
    
    public Instant getGeneratedAt() {
        return generatedAt;
    }
    
    public Map<String, ResourceUsage> getResources() {
        return resources;
    }
    
    public ResourceUsage getUsage(ResourceKind kind) {
        return resources.get(kind.getValue());
    }
    
    /**
     * Usage of one resource kind.
     */
    public static class ResourceUsage {
        
        @JsonProperty("used")
        private final long used;
        
        // null when unlimited
        @JsonProperty("limit")
        private final Long limit;
        
        @JsonProperty("resets_at")
        private final Instant resetsAt;
        
        public ResourceUsage(long used, long limit, Instant resetsAt) {
            this.used = used;
            this.limit = limit == Long.MAX_VALUE ? null : limit;
            this.resetsAt = resetsAt;
        }
        
        public long getUsed() {
            return used;
        }
        
        public Long getLimit() {
            return limit;
        }
        
        public Instant getResetsAt() {
            return resetsAt;
        }
        
        public boolean isUnlimited() {
            return limit == null;
        }
    }
}
