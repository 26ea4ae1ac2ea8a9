package com.eduhub.security;

import com.eduhub.domain.PlanTier;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of the tenant a unit of work runs for.
 * 
 * Created by the {@link TenantResolver} at request start and bound with
 * {@link TenantContextHolder} for the lifetime of the request. It is never
 * persisted and never shared between concurrent requests. Status, plan and
 * config are copies taken at resolution time.
 */
public final class TenantContext {
    
    private final String tenantId;
    private final TenantStatus status;
    private final PlanTier plan;
    private final Map<String, Object> config;
    private final ResolutionSource source;
    
    public TenantContext(String tenantId, TenantStatus status, PlanTier plan,
                         Map<String, Object> config, ResolutionSource source) {
        if (tenantId == null || tenantId.trim().isEmpty()) {
            throw new IllegalArgumentException("Tenant ID must not be null or empty");
        }
        this.tenantId = tenantId;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.config = config != null
            ? Collections.unmodifiableMap(new HashMap<>(config))
            : Collections.emptyMap();
        this.source = source;
    }
    
    /**
     * Build a context from a directory record.
     * 
     * @param tenant the resolved tenant
     * @param source the signal it was resolved from
     * @return the context snapshot
     */
    public static TenantContext of(Tenant tenant, ResolutionSource source) {
        return new TenantContext(tenant.getId(), tenant.getStatus(), tenant.getPlan(), tenant.getConfig(), source);
    }
    
    public String getTenantId() {
        return tenantId;
    }
    
    public TenantStatus getStatus() {
        return status;
    }
    
    public PlanTier getPlan() {
        return plan;
    }
    
    /**
     * @return read-only view of the tenant config at resolution time
     */
    public Map<String, Object> getConfig() {
        return config;
    }
    
    public ResolutionSource getSource() {
        return source;
    }
    
    /**
     * @return true if downstream quota checks must apply reduced limits
     */
    public boolean isLimited() {
        return status.isRestricted();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TenantContext)) {
            return false;
        }
        TenantContext that = (TenantContext) o;
        return tenantId.equals(that.tenantId)
            && status == that.status
            && plan == that.plan
            && config.equals(that.config)
            && source == that.source;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(tenantId, status, plan, config, source);
    }
    
    @Override
    public String toString() {
        return "TenantContext{" +
                "tenantId='" + tenantId + '\'' +
                ", status=" + status +
                ", plan=" + plan +
                ", source=" + source +
                '}';
    }
}
