package com.eduhub.tenant;

import com.eduhub.directory.DuplicateIdentifierException;
import com.eduhub.directory.InMemoryTenantDirectory;
import com.eduhub.directory.TenantNotFoundException;
import com.eduhub.domain.PlanTier;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TenantRegistrationService
 */
@DisplayName("TenantRegistrationService Tests")
class TenantRegistrationServiceTest {
    
    private InMemoryTenantDirectory directory;
    private TenantRegistrationService service;
    
    @BeforeEach
    void setUp() {
        directory = new InMemoryTenantDirectory();
        service = new TenantRegistrationService(directory, List.of("app", "www", "api"), "eduhub.io");
    }
    
    private static TenantRegistrationRequest request(String name, String subdomain) {
        TenantRegistrationRequest request = new TenantRegistrationRequest();
        request.setName(name);
        request.setSubdomain(subdomain);
        return request;
    }
    
    @Test
    @DisplayName("Should register a trial tenant on the basic plan by default")
    void shouldRegisterWithDefaults() {
        // When
        Tenant tenant = service.register(request("Acme Academy", "acme"));
        
        // Then
        assertThat(tenant.getId()).isNotBlank();
        assertThat(tenant.getStatus()).isEqualTo(TenantStatus.TRIAL);
        assertThat(tenant.getPlan()).isEqualTo(PlanTier.BASIC);
        assertThat(directory.lookupBySubdomain("acme")).isPresent();
    }
    
    @Test
    @DisplayName("Should honor custom domain and config but start on the basic plan")
    void shouldRegisterWithOptions() {
        // Given
        TenantRegistrationRequest request = request("Globex High", "globex");
        request.setCustomDomain("Portal.Globex.EDU");
        request.setConfig(Map.of("timezone", "Europe/Berlin"));
        
        // When
        Tenant tenant = service.register(request);
        
        // Then
        assertThat(tenant.getPlan()).isEqualTo(PlanTier.BASIC);
        assertThat(tenant.getStatus()).isEqualTo(TenantStatus.TRIAL);
        assertThat(directory.lookupByCustomDomain("portal.globex.edu")).get()
            .extracting(Tenant::getId).isEqualTo(tenant.getId());
        assertThat(tenant.getConfig()).containsEntry("timezone", "Europe/Berlin");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"-acme", "acme-", "ac_me", "acme.school", ""})
    @DisplayName("Should reject malformed subdomains")
    void shouldRejectMalformedSubdomain(String subdomain) {
        assertThatThrownBy(() -> service.register(request("Acme", subdomain)))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("Should reject reserved subdomains")
    void shouldRejectReservedSubdomain() {
        assertThatThrownBy(() -> service.register(request("Acme", "www")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reserved");
        assertThat(directory.lookupBySubdomain("www")).isEmpty();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"eduhub.io", "app.eduhub.io", "WWW.EduHub.io", "globex.eduhub.io", "a.b.eduhub.io"})
    @DisplayName("Should reject custom domains on the platform domain")
    void shouldRejectPlatformCustomDomain(String customDomain) {
        // Given
        TenantRegistrationRequest request = request("Globex High", "globex");
        request.setCustomDomain(customDomain);
        
        // When / Then
        assertThatThrownBy(() -> service.register(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("platform domain");
        assertThat(directory.lookupBySubdomain("globex")).isEmpty();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"bad_host.edu", "no-dot", "1.2.3.4", "-portal.globex.edu", "portal..globex.edu", "portal.globex.edu:8080"})
    @DisplayName("Should reject malformed custom domains")
    void shouldRejectMalformedCustomDomain(String customDomain) {
        TenantRegistrationRequest request = request("Globex High", "globex");
        request.setCustomDomain(customDomain);
        
        assertThatThrownBy(() -> service.register(request))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(directory.lookupBySubdomain("globex")).isEmpty();
    }
    
    @Test
    @DisplayName("Should reject custom domains whose first label is reserved")
    void shouldRejectReservedCustomDomainLabel() {
        TenantRegistrationRequest request = request("Globex High", "globex");
        request.setCustomDomain("www.globex.edu");
        
        assertThatThrownBy(() -> service.register(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("reserved");
    }
    
    @Test
    @DisplayName("Should treat a blank custom domain as absent")
    void shouldIgnoreBlankCustomDomain() {
        TenantRegistrationRequest request = request("Globex High", "globex");
        request.setCustomDomain("  ");
        
        Tenant tenant = service.register(request);
        
        assertThat(tenant.getCustomDomain()).isNull();
    }
    
    @Test
    @DisplayName("Should refuse a subdomain that is already claimed")
    void shouldRejectDuplicate() {
        service.register(request("Acme", "acme"));
        
        assertThatThrownBy(() -> service.register(request("Other Acme", "ACME")))
            .isInstanceOf(DuplicateIdentifierException.class);
    }
    
    @Test
    @DisplayName("Should apply status, plan and config changes")
    void shouldManageTenant() {
        // Given
        Tenant tenant = service.register(request("Acme", "acme"));
        Map<String, Object> partial = new HashMap<>();
        partial.put("theme", "dark");
        
        // When
        service.changeStatus(tenant.getId(), TenantStatus.LIMITED);
        service.changePlan(tenant.getId(), PlanTier.ENTERPRISE);
        service.mergeConfig(tenant.getId(), partial);
        
        // Then
        Tenant current = service.currentTenant(tenant.getId());
        assertThat(current.getStatus()).isEqualTo(TenantStatus.LIMITED);
        assertThat(current.getPlan()).isEqualTo(PlanTier.ENTERPRISE);
        assertThat(current.getConfig()).containsEntry("theme", "dark");
    }
    
    @Test
    @DisplayName("Should reject missing changes and unknown tenants")
    void shouldRejectInvalidChanges() {
        assertThatThrownBy(() -> service.changeStatus("ghost", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.changePlan("ghost", PlanTier.BASIC)).isInstanceOf(TenantNotFoundException.class);
        assertThatThrownBy(() -> service.currentTenant("ghost")).isInstanceOf(TenantNotFoundException.class);
    }
}
