package com.eduhub.security;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Collections;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * The tenant-relevant signals of one inbound request.
 * 
 * Decoupled from the servlet API so the resolver can be driven by any
 * transport. Header names are case-insensitive.
 */
public class TenantRequest {
    
    private static final String HOST_HEADER = "Host";
    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";
    
    private final String host;
    private final Map<String, String> headers;
    private final String bearerToken;
    private final boolean publicRoute;
    
    private TenantRequest(Builder builder) {
        this.host = builder.host;
        this.headers = Collections.unmodifiableMap(builder.headers);
        this.bearerToken = builder.bearerToken;
        this.publicRoute = builder.publicRoute;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Capture the signals of a servlet request.
     * 
     * @param request the HTTP request
     * @param publicRoute whether the route may be served without a tenant
     * @return the request signals
     */
    public static TenantRequest from(HttpServletRequest request, boolean publicRoute) {
        Builder builder = builder().publicRoute(publicRoute);
        
        Enumeration<String> names = request.getHeaderNames();
        if (names != null) {
            while (names.hasMoreElements()) {
                String name = names.nextElement();
                builder.header(name, request.getHeader(name));
            }
        }
        
        String host = request.getHeader(HOST_HEADER);
        builder.host(host != null ? host : request.getServerName());
        builder.bearerToken(extractToken(request.getHeader(AUTHORIZATION_HEADER)));
        return builder.build();
    }
    
    /**
     * Extract the token from an Authorization header value.
     * 
     * @param authHeader e.g. "Bearer eyJhbGciOi..."
     * @return the token, or null if the header carries no bearer token
     */
    static String extractToken(String authHeader) {
        if (authHeader == null) {
            return null;
        }
        String value = authHeader.trim();
        if (!value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = value.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
    
    public String getHost() {
        return host;
    }
    
    /**
     * @param name header name, any case
     * @return the header value, or null
     */
    public String getHeader(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
    
    public String getBearerToken() {
        return bearerToken;
    }
    
    public boolean isPublicRoute() {
        return publicRoute;
    }
    
    public static class Builder {
        private String host;
        private final Map<String, String> headers = new TreeMap<>();
        private String bearerToken;
        private boolean publicRoute;
        
        public Builder host(String host) {
            this.host = host;
            return this;
        }
        
        public Builder header(String name, String value) {
            if (name != null && value != null) {
                headers.put(name.toLowerCase(Locale.ROOT), value);
            }
            return this;
        }
        
        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }
        
        public Builder publicRoute(boolean publicRoute) {
            this.publicRoute = publicRoute;
            return this;
        }
        
        public TenantRequest build() {
            return new TenantRequest(this);
        }
    }
}
