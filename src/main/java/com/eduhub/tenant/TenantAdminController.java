package com.eduhub.tenant;

import com.eduhub.domain.Tenant;
import com.eduhub.security.TenantResolver;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Internal endpoints the billing system uses to change tenant state.
 *
 * Every call must present the configured service key in the
 * X-Service-Key header. With no key configured the endpoints are closed.
 */
@RestController
@RequestMapping("/internal/tenants")
public class TenantAdminController {
    
    private static final Logger log = LoggerFactory.getLogger(TenantAdminController.class);
    
    private final TenantRegistrationService registrationService;
    private final String serviceKey;
    
    public TenantAdminController(
        TenantRegistrationService registrationService,
        @Value("${eduhub.tenant.service-key:}") String serviceKey
    ) {
        this.registrationService = registrationService;
        this.serviceKey = serviceKey;
    }
    
    @PutMapping("/{tenantId}/status")
    public Tenant changeStatus(
        @RequestHeader(value = TenantResolver.SERVICE_KEY_HEADER, required = false) String presentedKey,
        @PathVariable String tenantId,
        @Valid @RequestBody StatusChange change
    ) {
        authorize(presentedKey);
        return registrationService.changeStatus(tenantId, change.getStatus());
    }
    
    @PutMapping("/{tenantId}/plan")
    public Tenant changePlan(
        @RequestHeader(value = TenantResolver.SERVICE_KEY_HEADER, required = false) String presentedKey,
        @PathVariable String tenantId,
        @Valid @RequestBody PlanChange change
    ) {
        authorize(presentedKey);
        return registrationService.changePlan(tenantId, change.getPlan());
    }
    
    @PatchMapping("/{tenantId}/config")
    public Tenant mergeConfig(
        @RequestHeader(value = TenantResolver.SERVICE_KEY_HEADER, required = false) String presentedKey,
        @PathVariable String tenantId,
        @RequestBody Map<String, Object> partialConfig
    ) {
        authorize(presentedKey);
        return registrationService.mergeConfig(tenantId, partialConfig);
    }
    
    private void authorize(String presentedKey) {
        if (!StringUtils.hasText(serviceKey)) {
            log.warn("Internal tenant endpoint called but no service key is configured");
            throw new ServiceKeyRejectedException("Internal endpoints are disabled");
        }
        if (presentedKey == null || !MessageDigest.isEqual(
                serviceKey.getBytes(StandardCharsets.UTF_8), presentedKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected internal tenant call with invalid service key");
            throw new ServiceKeyRejectedException("Invalid service key");
        }
    }
}
