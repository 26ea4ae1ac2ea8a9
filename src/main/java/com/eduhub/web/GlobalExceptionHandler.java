package com.eduhub.web;

import com.eduhub.directory.DuplicateIdentifierException;
import com.eduhub.directory.TenantNotFoundException;
import com.eduhub.isolation.RecordNotFoundException;
import com.eduhub.quota.QuotaExceededException;
import com.eduhub.security.TenantInactiveException;
import com.eduhub.security.TenantIsolationException;
import com.eduhub.security.TenantNotIdentifiedException;
import com.eduhub.tenant.InvalidCustomFieldException;
import com.eduhub.tenant.ServiceKeyRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * Inactive tenants and isolation failures get generic bodies: the first so
 * the tenant's existence is not disclosed, the second so no other tenant's
 * identifiers reach the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    private static final String ERROR_TYPE_BASE = "https://eduhub.io/errors/";
    
    @ExceptionHandler(TenantNotIdentifiedException.class)
    public ProblemDetail handleTenantNotIdentified(TenantNotIdentifiedException ex) {
        log.warn("Tenant not identified: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Tenant Not Identified", "tenant-not-identified", ex.getMessage());
    }
    
    @ExceptionHandler(TenantInactiveException.class)
    public ProblemDetail handleTenantInactive(TenantInactiveException ex) {
        log.info("Request for inactive tenant {}", ex.getTenantId());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", "The requested resource was not found");
    }
    
    @ExceptionHandler(TenantNotFoundException.class)
    public ProblemDetail handleTenantNotFound(TenantNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }
    
    @ExceptionHandler(RecordNotFoundException.class)
    public ProblemDetail handleRecordNotFound(RecordNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }
    
    @ExceptionHandler(TenantIsolationException.class)
    public ProblemDetail handleIsolationViolation(TenantIsolationException ex) {
        log.error("Tenant isolation violation", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
            "An unexpected error occurred");
    }
    
    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ProblemDetail> handleQuotaExceeded(QuotaExceededException ex) {
        ProblemDetail problem = problem(HttpStatus.TOO_MANY_REQUESTS, "Quota Exceeded", "quota-exceeded", ex.getMessage());
        problem.setProperty("resource", ex.getKind().getValue());
        problem.setProperty("limit", ex.getLimit());
        problem.setProperty("current", ex.getCurrent());
        
        ResponseEntity.BodyBuilder response = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (ex.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        }
        return response.body(problem);
    }
    
    @ExceptionHandler(DuplicateIdentifierException.class)
    public ProblemDetail handleDuplicate(DuplicateIdentifierException ex) {
        log.info("Registration conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }
    
    @ExceptionHandler(ServiceKeyRejectedException.class)
    public ProblemDetail handleServiceKeyRejected(ServiceKeyRejectedException ex) {
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }
    
    @ExceptionHandler(InvalidCustomFieldException.class)
    public ProblemDetail handleInvalidCustomField(InvalidCustomFieldException ex) {
        log.warn("Invalid custom field: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Custom Field", "invalid-custom-field",
            ex.getMessage());
        problem.setProperty("field", ex.getField());
        return problem;
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Malformed request body");
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }
    
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
            "An unexpected error occurred");
    }
    
    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
