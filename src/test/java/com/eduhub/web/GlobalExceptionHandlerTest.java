package com.eduhub.web;

import com.eduhub.directory.DuplicateIdentifierException;
import com.eduhub.domain.ResourceKind;
import com.eduhub.isolation.CrossTenantReadException;
import com.eduhub.quota.QuotaExceededException;
import com.eduhub.security.TenantInactiveException;
import com.eduhub.security.TenantNotIdentifiedException;
import com.eduhub.tenant.InvalidCustomFieldException;
import com.eduhub.tenant.ServiceKeyRejectedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GlobalExceptionHandler}, exercised without a Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {
    
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    
    @Test
    @DisplayName("maps unidentified tenant to 400")
    void handlesTenantNotIdentified() {
        ProblemDetail result = handler.handleTenantNotIdentified(new TenantNotIdentifiedException("No tenant"));
        
        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getType().toString()).isEqualTo("https://eduhub.io/errors/tenant-not-identified");
    }
    
    @Test
    @DisplayName("maps inactive tenant to a generic 404 without naming the tenant")
    void handlesInactiveAsNotFound() {
        ProblemDetail result = handler.handleTenantInactive(new TenantInactiveException("tenant-secret"));
        
        assertThat(result.getStatus()).isEqualTo(404);
        assertThat(result.getDetail()).doesNotContain("tenant-secret");
    }
    
    @Test
    @DisplayName("maps isolation violations to an opaque 500")
    void handlesIsolationViolation() {
        ProblemDetail result = handler.handleIsolationViolation(
            new CrossTenantReadException("tenant-a", "tenant-b", "student"));
        
        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("tenant-b");
    }
    
    @Test
    @DisplayName("maps exceeded quota to 429 with Retry-After")
    void handlesQuotaExceeded() {
        ResponseEntity<ProblemDetail> result = handler.handleQuotaExceeded(
            new QuotaExceededException("tenant-a", ResourceKind.API_CALLS, 100, 100, 3600L));
        
        assertThat(result.getStatusCode().value()).isEqualTo(429);
        assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("3600");
        assertThat(result.getBody().getProperties()).containsEntry("resource", "api_calls");
    }
    
    @Test
    @DisplayName("omits Retry-After for cumulative resources")
    void handlesCumulativeQuota() {
        ResponseEntity<ProblemDetail> result = handler.handleQuotaExceeded(
            new QuotaExceededException("tenant-a", ResourceKind.STUDENTS, 500, 500, null));
        
        assertThat(result.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
    }
    
    @Test
    @DisplayName("maps duplicates to 409, rejected keys to 403 and bad custom fields to 400")
    void handlesClientErrors() {
        assertThat(handler.handleDuplicate(new DuplicateIdentifierException("subdomain", "acme")).getStatus())
            .isEqualTo(409);
        assertThat(handler.handleServiceKeyRejected(new ServiceKeyRejectedException("Invalid service key")).getStatus())
            .isEqualTo(403);
        
        ProblemDetail invalid = handler.handleInvalidCustomField(new InvalidCustomFieldException("house", "bad"));
        assertThat(invalid.getStatus()).isEqualTo(400);
        assertThat(invalid.getProperties()).containsEntry("field", "house");
    }
    
    @Test
    @DisplayName("maps generic Exception to 500 with timestamp")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));
        
        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
