package com.eduhub.security;

/**
 * The request signal a tenant was resolved from, in precedence order.
 */
public enum ResolutionSource {
    SUBDOMAIN,
    CUSTOM_DOMAIN,
    HEADER,
    TOKEN_CLAIM
}
