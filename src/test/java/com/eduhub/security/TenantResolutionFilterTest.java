package com.eduhub.security;

import com.eduhub.directory.InMemoryTenantDirectory;
import com.eduhub.domain.Tenant;
import com.eduhub.domain.TenantStatus;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TenantResolutionFilter
 *
 * These tests verify that the filter:
 * - Binds the resolved tenant for exactly the rest of the chain
 * - Lets public routes through without a tenant
 * - Hands resolution failures to the MVC exception resolver
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TenantResolutionFilter Tests")
class TenantResolutionFilterTest {
    
    private static final List<String> PUBLIC_PATHS = List.of("/api/tenants", "/actuator/**", "/internal/**", "/error");
    
    @Mock
    private TokenVerifier tokenVerifier;
    
    @Mock
    private HandlerExceptionResolver exceptionResolver;
    
    private InMemoryTenantDirectory directory;
    private TenantResolutionFilter filter;
    
    @BeforeEach
    void setUp() {
        directory = new InMemoryTenantDirectory();
        directory.create(Tenant.builder().id("t-acme").subdomain("acme").name("Acme").status(TenantStatus.ACTIVE).build());
        TenantResolver resolver = new TenantResolver(directory, tokenVerifier, "eduhub.io",
            List.of("app", "www", "api"), "", "tenant_id");
        filter = new TenantResolutionFilter(resolver, exceptionResolver, PUBLIC_PATHS);
    }
    
    @AfterEach
    void tearDown() {
        assertThat(TenantContextHolder.current()).isEmpty();
    }
    
    private static MockHttpServletRequest request(String host, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.addHeader("Host", host);
        return request;
    }
    
    @Test
    @DisplayName("Should bind tenant context while the chain runs and release it afterwards")
    void shouldBindContextForChain() throws Exception {
        // Given
        AtomicReference<Optional<TenantContext>> seen = new AtomicReference<>();
        FilterChain chain = (ServletRequest req, ServletResponse res) -> seen.set(TenantContextHolder.current());
        
        // When
        filter.doFilter(request("acme.eduhub.io", "/api/students"), new MockHttpServletResponse(), chain);
        
        // Then
        assertThat(seen.get()).map(TenantContext::getTenantId).contains("t-acme");
        verifyNoInteractions(exceptionResolver);
    }
    
    @Test
    @DisplayName("Should release tenant context when the chain throws")
    void shouldReleaseContextOnFailure() {
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("handler failed");
        };
        
        assertThatThrownBy(() ->
            filter.doFilter(request("acme.eduhub.io", "/api/students"), new MockHttpServletResponse(), chain))
            .isInstanceOf(IllegalStateException.class);
    }
    
    @Test
    @DisplayName("Should pass public route through without tenant")
    void shouldAllowPublicRoute() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletRequest request = request("eduhub.io", "/api/tenants");
        
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        
        verify(chain).doFilter(eq(request), any());
        verifyNoInteractions(exceptionResolver);
    }
    
    @Test
    @DisplayName("Should hand unidentified tenant to the exception resolver without calling the chain")
    void shouldRejectUnidentifiedTenant() throws Exception {
        FilterChain chain = mock(FilterChain.class);
        MockHttpServletRequest request = request("eduhub.io", "/api/students");
        MockHttpServletResponse response = new MockHttpServletResponse();
        
        filter.doFilter(request, response, chain);
        
        verify(exceptionResolver).resolveException(eq(request), eq(response), isNull(),
            any(TenantNotIdentifiedException.class));
        verifyNoInteractions(chain);
    }
    
    @Test
    @DisplayName("Should hand inactive tenant to the exception resolver")
    void shouldRejectInactiveTenant() throws Exception {
        directory.updateStatus("t-acme", TenantStatus.INACTIVE);
        FilterChain chain = mock(FilterChain.class);
        
        filter.doFilter(request("acme.eduhub.io", "/api/students"), new MockHttpServletResponse(), chain);
        
        verify(exceptionResolver).resolveException(any(), any(), isNull(), any(TenantInactiveException.class));
        verifyNoInteractions(chain);
    }
    
    @Test
    @DisplayName("Should match public paths with Ant patterns")
    void shouldMatchPublicPaths() {
        assertThat(filter.isPublicRoute(new MockHttpServletRequest("GET", "/actuator/health"))).isTrue();
        assertThat(filter.isPublicRoute(new MockHttpServletRequest("PUT", "/internal/tenants/t-1/status"))).isTrue();
        assertThat(filter.isPublicRoute(new MockHttpServletRequest("GET", "/api/tenants/current"))).isFalse();
        assertThat(filter.isPublicRoute(new MockHttpServletRequest("GET", "/api/students"))).isFalse();
    }
}
