package com.eduhub.security;

import com.eduhub.directory.HostNames;
import com.eduhub.directory.TenantDirectory;
import com.eduhub.domain.Tenant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tenant Resolver
 *
 * Maps the signals of one inbound request to a {@link TenantContext}.
 * Signals are tried in a fixed order and the first one that names a known
 * tenant wins:
 * 1. Subdomain of the Host header (reserved subdomains excluded)
 * 2. Exact Host match against a registered custom domain
 * 3. The X-Tenant-ID header, for trusted service-to-service calls. It is
 *    honored only with a matching X-Service-Key; with no service key
 *    configured the header is ignored.
 * 4. The tenant claim of a verified bearer token
 *
 * If nothing matches, public routes proceed without a tenant and every
 * other route is rejected with {@link TenantNotIdentifiedException}. There
 * is no default tenant.
 *
 * A matched tenant that is inactive is rejected with
 * {@link TenantInactiveException}. A limited tenant is accepted and its
 * context is flagged so quota checks apply reduced limits.
 *
 * The resolver only reads the directory; resolving the same signals twice
 * with no change in between yields equal contexts.
 *
 * @see TenantContextHolder
 * @see TenantResolutionFilter
 */
@Component
public class TenantResolver {
    
    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);
    
    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String SERVICE_KEY_HEADER = "X-Service-Key";
    
    private final TenantDirectory tenantDirectory;
    private final TokenVerifier tokenVerifier;
    private final String baseDomain;
    private final Set<String> reservedSubdomains;
    private final String serviceKey;
    private final String tenantClaim;
    
    public TenantResolver(
        TenantDirectory tenantDirectory,
        TokenVerifier tokenVerifier,
        @Value("${eduhub.tenant.base-domain:}") String baseDomain,
        @Value("${eduhub.tenant.reserved-subdomains:app,www,api}") List<String> reservedSubdomains,
        @Value("${eduhub.tenant.service-key:}") String serviceKey,
        @Value("${eduhub.security.jwt.tenant-claim:tenant_id}") String tenantClaim
    ) {
        this.tenantDirectory = tenantDirectory;
        this.tokenVerifier = tokenVerifier;
        this.baseDomain = HostNames.normalize(baseDomain);
        this.reservedSubdomains = reservedSubdomains.stream()
            .map(HostNames::normalize)
            .filter(s -> s != null)
            .collect(Collectors.toUnmodifiableSet());
        this.serviceKey = StringUtils.hasText(serviceKey) ? serviceKey : null;
        this.tenantClaim = tenantClaim;
        if (this.serviceKey == null) {
            log.warn("No eduhub.tenant.service-key configured; the {} header will be ignored", TENANT_HEADER);
        }
    }
    
    /**
     * Resolve the tenant of a request.
     *
     * @param request the request signals
     * @return the tenant context, or empty for a public route with no tenant signal
     * @throws TenantNotIdentifiedException if no signal matches and the route requires a tenant
     * @throws TenantInactiveException if the matched tenant is inactive
     */
    public Optional<TenantContext> resolve(TenantRequest request) {
        String host = HostNames.stripPort(request.getHost());
        
        Optional<TenantContext> match = bySubdomain(host)
            .or(() -> byCustomDomain(host))
            .or(() -> byHeader(request))
            .or(() -> byTokenClaim(request));
        
        if (match.isEmpty()) {
            if (request.isPublicRoute()) {
                log.debug("No tenant signal on public route (host: {})", host);
                return Optional.empty();
            }
            log.warn("Rejecting request without resolvable tenant (host: {})", host);
            throw new TenantNotIdentifiedException("Unable to identify the tenant for this request");
        }
        
        TenantContext context = match.get();
        if (!context.getStatus().allowsAccess()) {
            log.info("Rejecting request for inactive tenant {} (resolved by {})",
                context.getTenantId(), context.getSource());
            throw new TenantInactiveException(context.getTenantId());
        }
        
        if (context.isLimited()) {
            log.debug("Tenant {} is limited; reduced quotas apply", context.getTenantId());
        }
        return Optional.of(context);
    }
    
    /**
     * Extract the tenant subdomain from a bare host name.
     *
     * With a base domain configured, the subdomain is the single label in
     * front of it ("acme.eduhub.io" gives "acme"). Without one, it is the
     * first label of a host with at least three labels.
     *
     * @param host normalized host without port
     * @return the subdomain, or null if the host carries none
     */
    String extractSubdomain(String host) {
        if (host == null || isIpLiteral(host)) {
            return null;
        }
        
        String subdomain;
        if (baseDomain != null) {
            String suffix = "." + baseDomain;
            if (!host.endsWith(suffix)) {
                return null;
            }
            subdomain = host.substring(0, host.length() - suffix.length());
            if (subdomain.isEmpty() || subdomain.contains(".")) {
                return null;
            }
        } else {
            String[] labels = host.split("\\.");
            if (labels.length < 3) {
                return null;
            }
            subdomain = labels[0];
        }
        
        return reservedSubdomains.contains(subdomain) ? null : subdomain;
    }
    
    private Optional<TenantContext> bySubdomain(String host) {
        String subdomain = extractSubdomain(host);
        if (subdomain == null) {
            return Optional.empty();
        }
        return tenantDirectory.lookupBySubdomain(subdomain)
            .map(tenant -> matched(tenant, ResolutionSource.SUBDOMAIN));
    }
    
    private Optional<TenantContext> byCustomDomain(String host) {
        if (host == null || isPlatformHost(host)) {
            return Optional.empty();
        }
        return tenantDirectory.lookupByCustomDomain(host)
            .map(tenant -> matched(tenant, ResolutionSource.CUSTOM_DOMAIN));
    }
    
    // Hosts under the base domain belong to the platform, never to a custom domain mapping.
    private boolean isPlatformHost(String host) {
        return baseDomain != null && (host.equals(baseDomain) || host.endsWith("." + baseDomain));
    }
    
    private Optional<TenantContext> byHeader(TenantRequest request) {
        String tenantId = request.getHeader(TENANT_HEADER);
        if (!StringUtils.hasText(tenantId)) {
            return Optional.empty();
        }
        if (serviceKey == null || !serviceKeyMatches(request.getHeader(SERVICE_KEY_HEADER))) {
            log.warn("Ignoring {} header from caller without a valid service key", TENANT_HEADER);
            return Optional.empty();
        }
        return tenantDirectory.lookupByIdentifier(tenantId.trim())
            .map(tenant -> matched(tenant, ResolutionSource.HEADER));
    }
    
    private Optional<TenantContext> byTokenClaim(TenantRequest request) {
        String token = request.getBearerToken();
        if (token == null) {
            return Optional.empty();
        }
        return tokenVerifier.verify(token)
            .map(claims -> claimValue(claims))
            .flatMap(tenantDirectory::lookupByIdentifier)
            .map(tenant -> matched(tenant, ResolutionSource.TOKEN_CLAIM));
    }
    
    private String claimValue(Map<String, Object> claims) {
        Object value = claims.get(tenantClaim);
        return value != null && StringUtils.hasText(value.toString()) ? value.toString() : null;
    }
    
    private boolean serviceKeyMatches(String presented) {
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
            serviceKey.getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8));
    }
    
    private static boolean isIpLiteral(String host) {
        return host.startsWith("[") || host.toLowerCase(Locale.ROOT).matches("[0-9.]+");
    }
    
    private static TenantContext matched(Tenant tenant, ResolutionSource source) {
        log.debug("Resolved tenant {} by {}", tenant.getId(), source);
        return TenantContext.of(tenant, source);
    }
}
