package com.eduhub.tenant;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request model for institution self-registration.
 *
 * There is no plan field: new tenants always start on the basic plan and
 * only the billing endpoints change it.
 */
public class TenantRegistrationRequest {
    
    @NotBlank
    @Size(max = 200)
    private String name;
    
    @NotBlank
    @Pattern(regexp = TenantRegistrationService.SUBDOMAIN_PATTERN,
        message = "must be 1-63 lowercase letters, digits or hyphens and may not start or end with a hyphen")
    private String subdomain;
    
    @Size(max = 253)
    private String customDomain;
    
    private Map<String, Object> config;
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public String getSubdomain() {
        return subdomain;
    }
    
    public void setSubdomain(String subdomain) {
        this.subdomain = subdomain;
    }
    
    public String getCustomDomain() {
        return customDomain;
    }
    
    public void setCustomDomain(String customDomain) {
        this.customDomain = customDomain;
    }
    
    public Map<String, Object> getConfig() {
        return config;
    }
    
    public void setConfig(Map<String, Object> config) {
        this.config = config;
    }
}
