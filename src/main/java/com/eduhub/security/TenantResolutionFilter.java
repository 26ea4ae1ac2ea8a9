package com.eduhub.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Tenant Resolution Filter
 *
 * Resolves the tenant of every inbound HTTP request and binds it with
 * {@link TenantContextHolder} for exactly the remainder of the filter chain.
 * The binding is released when the chain returns, whether it completed or
 * failed, so no context outlives its request.
 *
 * Request Flow:
 * 1. Capture host, headers and bearer token as a {@link TenantRequest}
 * 2. Resolve the tenant with {@link TenantResolver}
 * 3. Run the rest of the chain inside the tenant scope
 *
 * Public routes (registration, health checks, internal billing callbacks)
 * proceed without a tenant when the request carries no tenant signal.
 * Resolution failures are handed to the MVC exception handlers so they are
 * rendered like any other API error.
 *
 * @see TenantResolver
 * @see TenantContextHolder
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class TenantResolutionFilter extends OncePerRequestFilter {
    
    private static final Logger log = LoggerFactory.getLogger(TenantResolutionFilter.class);
    
    private final TenantResolver tenantResolver;
    private final HandlerExceptionResolver exceptionResolver;
    private final List<String> publicPaths;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    
    public TenantResolutionFilter(
        TenantResolver tenantResolver,
        @Qualifier("handlerExceptionResolver") HandlerExceptionResolver exceptionResolver,
        @Value("${eduhub.tenant.public-paths:/api/tenants,/actuator/**,/internal/**,/error}") List<String> publicPaths
    ) {
        this.tenantResolver = tenantResolver;
        this.exceptionResolver = exceptionResolver;
        this.publicPaths = List.copyOf(publicPaths);
    }
    
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        
        Optional<TenantContext> context;
        try {
            context = tenantResolver.resolve(TenantRequest.from(request, isPublicRoute(request)));
        } catch (TenantNotIdentifiedException | TenantInactiveException e) {
            log.debug("Tenant resolution failed for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
            exceptionResolver.resolveException(request, response, null, e);
            return;
        }
        
        if (context.isEmpty()) {
            chain.doFilter(request, response);
            return;
        }
        
        try (TenantContextHolder.Scope ignored = TenantContextHolder.open(context.get())) {
            chain.doFilter(request, response);
        }
    }
    
    /**
     * @return true if the request may be served without a tenant context
     */
    boolean isPublicRoute(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return publicPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }
}
