package com.eduhub.web;

import com.eduhub.quota.ResourceAccountant;
import com.eduhub.quota.UsageReport;
import com.eduhub.security.TenantContextHolder;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Usage of the current tenant against its plan.
 */
@RestController
@RequestMapping("/api/usage")
public class UsageController {
    
    private final ResourceAccountant resourceAccountant;
    
    public UsageController(ResourceAccountant resourceAccountant) {
        this.resourceAccountant = resourceAccountant;
    }
    
    @GetMapping
    public UsageReport usage() {
        return resourceAccountant.report(TenantContextHolder.requireTenantId());
    }
}
