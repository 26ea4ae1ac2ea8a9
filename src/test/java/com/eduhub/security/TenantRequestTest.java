package com.eduhub.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantRequest")
class TenantRequestTest {
    
    @Test
    @DisplayName("should capture host, headers and bearer token from servlet request")
    void shouldCaptureSignals() {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/api/students");
        servletRequest.addHeader("Host", "acme.eduhub.io");
        servletRequest.addHeader("X-Tenant-ID", "t-acme");
        servletRequest.addHeader("Authorization", "Bearer abc.def.ghi");
        
        TenantRequest request = TenantRequest.from(servletRequest, false);
        
        assertThat(request.getHost()).isEqualTo("acme.eduhub.io");
        assertThat(request.getHeader("x-tenant-id")).isEqualTo("t-acme");
        assertThat(request.getBearerToken()).isEqualTo("abc.def.ghi");
        assertThat(request.isPublicRoute()).isFalse();
    }
    
    @Test
    @DisplayName("should only accept bearer authorization")
    void shouldExtractBearerTokenOnly() {
        assertThat(TenantRequest.extractToken("bearer xyz")).isEqualTo("xyz");
        assertThat(TenantRequest.extractToken("Basic dXNlcjpwYXNz")).isNull();
        assertThat(TenantRequest.extractToken("Bearer   ")).isNull();
        assertThat(TenantRequest.extractToken(null)).isNull();
    }
}
