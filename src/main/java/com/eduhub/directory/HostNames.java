package com.eduhub.directory;

import java.util.Locale;

/**
 * Normalization of subdomains and host names used as tenant identifiers.
 */
public final class HostNames {
    
    private HostNames() {
        throw new UnsupportedOperationException("HostNames is a utility class and cannot be instantiated");
    }
    
    /**
     * Lower-case, trim and drop a trailing dot.
     * 
     * @param name a subdomain or host name, may be null
     * @return the normalized name, or null if blank
     */
    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.isEmpty() ? null : normalized;
    }
    
    /**
     * Normalize a Host header value and strip the port, if any.
     * 
     * @param host the Host header, e.g. "Acme.EduHub.io:8443"
     * @return the bare host name, or null if blank
     */
    public static String stripPort(String host) {
        String normalized = normalize(host);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("[")) {
            // IPv6 literal
            int end = normalized.indexOf(']');
            return end > 0 ? normalized.substring(0, end + 1) : normalized;
        }
        int colon = normalized.indexOf(':');
        return colon >= 0 ? normalize(normalized.substring(0, colon)) : normalized;
    }
}
