package com.eduhub.tenant;

import com.eduhub.directory.HostNames;
import com.eduhub.directory.TenantDirectory;
import com.eduhub.directory.TenantNotFoundException;
import com.eduhub.domain.PlanTier;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tenant registration and billing-driven administration.
 *
 * Responsibilities:
 * - Validate and register new institutions, always in trial status on the basic plan
 * - Apply status, plan and config changes pushed by the billing system
 *
 * Plan tiers are written only through {@link #changePlan}, which is reachable
 * from the internal billing endpoints alone.
 */
@Service
public class TenantRegistrationService {
    
    private static final Logger log = LoggerFactory.getLogger(TenantRegistrationService.class);
    
    public static final String SUBDOMAIN_PATTERN = "^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$";
    
    private static final Pattern SUBDOMAIN = Pattern.compile(SUBDOMAIN_PATTERN);
    
    private static final String LABEL = "[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?";
    
    /**
     * Fully qualified host name of at least two labels, with an alphabetic top-level label.
     */
    private static final String CUSTOM_DOMAIN_PATTERN = "^(?=.{1,253}$)(?:" + LABEL + "\\.)+[a-z](?:[a-z0-9-]{0,61}[a-z0-9])?$";
    
    private static final Pattern CUSTOM_DOMAIN = Pattern.compile(CUSTOM_DOMAIN_PATTERN);
    
    private final TenantDirectory tenantDirectory;
    private final Set<String> reservedSubdomains;
    private final String baseDomain;
    
    public TenantRegistrationService(
        TenantDirectory tenantDirectory,
        @Value("${eduhub.tenant.reserved-subdomains:app,www,api}") List<String> reservedSubdomains,
        @Value("${eduhub.tenant.base-domain:}") String baseDomain
    ) {
        this.tenantDirectory = tenantDirectory;
        this.baseDomain = HostNames.normalize(baseDomain);
        this.reservedSubdomains = reservedSubdomains.stream()
            .map(HostNames::normalize)
            .filter(s -> s != null)
            .collect(Collectors.toUnmodifiableSet());
    }
    
    /**
     * Register a new institution.
     *
     * @return the stored tenant, in trial status on the basic plan
     * @throws IllegalArgumentException if the subdomain or custom domain is malformed or reserved
     * @throws com.eduhub.directory.DuplicateIdentifierException if the subdomain or custom domain is taken
     */
    public Tenant register(TenantRegistrationRequest request) {
        validateRequest(request);
        
        String subdomain = HostNames.normalize(request.getSubdomain());
        
        Tenant tenant = tenantDirectory.create(Tenant.builder()
            .name(request.getName().trim())
            .subdomain(subdomain)
            .customDomain(HostNames.normalize(request.getCustomDomain()))
            .status(TenantStatus.TRIAL)
            .plan(PlanTier.BASIC)
            .config(request.getConfig() != null ? new HashMap<>(request.getConfig()) : new HashMap<>())
            .build());
        
        log.info("Registered tenant {} (subdomain: {}, plan: {})", tenant.getId(), tenant.getSubdomain(), tenant.getPlan());
        return tenant;
    }
    
    public Tenant currentTenant(String tenantId) {
        return tenantDirectory.lookupByIdentifier(tenantId)
            .orElseThrow(() -> new TenantNotFoundException(tenantId));
    }
    
    public Tenant changeStatus(String tenantId, TenantStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        Tenant tenant = tenantDirectory.updateStatus(tenantId, status);
        log.info("Tenant {} status changed to {}", tenantId, status);
        return tenant;
    }
    
    public Tenant changePlan(String tenantId, PlanTier plan) {
        if (plan == null) {
            throw new IllegalArgumentException("plan is required");
        }
        Tenant tenant = tenantDirectory.updatePlan(tenantId, plan);
        log.info("Tenant {} plan changed to {}", tenantId, plan);
        return tenant;
    }
    
    public Tenant mergeConfig(String tenantId, Map<String, Object> partialConfig) {
        if (partialConfig == null) {
            throw new IllegalArgumentException("config is required");
        }
        Tenant tenant = tenantDirectory.updateConfig(tenantId, partialConfig);
        log.info("Tenant {} config updated (keys: {})", tenantId, partialConfig.keySet());
        return tenant;
    }
    
    private void validateRequest(TenantRegistrationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is required");
        }
        if (request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        String subdomain = HostNames.normalize(request.getSubdomain());
        if (subdomain == null || !SUBDOMAIN.matcher(subdomain).matches()) {
            throw new IllegalArgumentException("Invalid subdomain: " + request.getSubdomain());
        }
        if (reservedSubdomains.contains(subdomain)) {
            throw new IllegalArgumentException("Subdomain is reserved: " + subdomain);
        }
        String customDomain = HostNames.normalize(request.getCustomDomain());
        if (customDomain != null) {
            validateCustomDomain(customDomain);
        }
    }
    
    /**
     * A custom domain must be a well-formed host outside the platform's own
     * namespace, so it can never shadow a subdomain or a platform host.
     */
    private void validateCustomDomain(String domain) {
        if (!CUSTOM_DOMAIN.matcher(domain).matches()) {
            throw new IllegalArgumentException("Invalid custom domain: " + domain);
        }
        if (baseDomain != null && (domain.equals(baseDomain) || domain.endsWith("." + baseDomain))) {
            throw new IllegalArgumentException("Custom domain may not be under the platform domain: " + domain);
        }
        String firstLabel = domain.substring(0, domain.indexOf('.'));
        if (reservedSubdomains.contains(firstLabel)) {
            throw new IllegalArgumentException("Custom domain uses a reserved name: " + domain);
        }
    }
}
