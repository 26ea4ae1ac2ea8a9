package com.eduhub.quota;

import com.eduhub.TenantFixtures;
import com.eduhub.domain.ResourceKind;
import com.eduhub.security.TenantContextHolder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApiQuotaInterceptor Tests")
class ApiQuotaInterceptorTest {
    
    @Mock
    private ResourceAccountant resourceAccountant;
    
    @InjectMocks
    private ApiQuotaInterceptor interceptor;
    
    @Test
    @DisplayName("Should charge one API call to the current tenant")
    void shouldChargeCurrentTenant() {
        try (TenantContextHolder.Scope ignored = TenantContextHolder.open(TenantFixtures.context("tenant-a"))) {
            boolean proceed = interceptor.preHandle(new MockHttpServletRequest(), new MockHttpServletResponse(), new Object());
            
            assertThat(proceed).isTrue();
        }
        verify(resourceAccountant).requireWithinQuota("tenant-a", ResourceKind.API_CALLS, 1L);
    }
    
    @Test
    @DisplayName("Should not charge requests without a tenant")
    void shouldSkipWithoutTenant() {
        boolean proceed = interceptor.preHandle(new MockHttpServletRequest(), new MockHttpServletResponse(), new Object());
        
        assertThat(proceed).isTrue();
        verifyNoInteractions(resourceAccountant);
    }
    
    @Test
    @DisplayName("Should propagate quota refusal")
    void shouldPropagateRefusal() {
        when(resourceAccountant.requireWithinQuota(anyString(), eq(ResourceKind.API_CALLS), eq(1L)))
            .thenThrow(new QuotaExceededException("tenant-a", ResourceKind.API_CALLS, 100, 100, 60L));
        
        try (TenantContextHolder.Scope ignored = TenantContextHolder.open(TenantFixtures.context("tenant-a"))) {
            assertThatThrownBy(() -> interceptor.preHandle(
                new MockHttpServletRequest(), new MockHttpServletResponse(), new Object()))
                .isInstanceOf(QuotaExceededException.class);
        }
    }
}
