package com.eduhub.quota;

import com.eduhub.domain.ResourceKind;
import com.eduhub.security.TenantContextHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Charges one API call to the tenant of every tenant-scoped request before
 * its handler runs. Requests without a tenant context are not charged.
 *
 * A refused call surfaces as {@link QuotaExceededException} and is rendered
 * as 429 by the exception handlers.
 */
@Component
public class ApiQuotaInterceptor implements HandlerInterceptor {
    
    private final ResourceAccountant resourceAccountant;
    
    public ApiQuotaInterceptor(ResourceAccountant resourceAccountant) {
        this.resourceAccountant = resourceAccountant;
    }
    
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        TenantContextHolder.current().ifPresent(context ->
            resourceAccountant.requireWithinQuota(context.getTenantId(), ResourceKind.API_CALLS, 1L));
        return true;
    }
}
