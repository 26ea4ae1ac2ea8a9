package com.eduhub.tenant;

import com.eduhub.domain.Tenant;
import com.eduhub.security.TenantContextHolder;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public registration API and the current tenant's own record.
 */
@RestController
@RequestMapping("/api/tenants")
public class TenantController {
    
    private final TenantRegistrationService registrationService;
    
    public TenantController(TenantRegistrationService registrationService) {
        this.registrationService = registrationService;
    }
    
    @PostMapping
    public ResponseEntity<Tenant> register(@Valid @RequestBody TenantRegistrationRequest request) {
        Tenant tenant = registrationService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(tenant);
    }
    
    @GetMapping("/current")
    public Tenant current() {
        return registrationService.currentTenant(TenantContextHolder.requireTenantId());
    }
}
