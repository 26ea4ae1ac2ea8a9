package com.eduhub.isolation;

import com.eduhub.security.NoTenantContextException;

import java.util.regex.Pattern;

/**
 * Each tenant's tables live in schema {@code tenant_<id>}, with the hyphens
 * of the id turned into underscores. Only ids made of [a-z0-9-] are
 * accepted, so two tenants can never map to the same schema.
 */
public class SchemaPerTenantLocator implements TableLocator {
    
    static final String SCHEMA_PREFIX = "tenant_";
    
    private static final Pattern SCHEMA_SAFE_ID = Pattern.compile("^[a-z0-9-]+$");
    
    @Override
    public String locate(String table, String tenantId) {
        return schemaFor(tenantId) + "." + table;
    }
    
    /**
     * @param tenantId the tenant identifier
     * @return the schema name holding the tenant's tables
     * @throws IllegalArgumentException if the id has characters outside [a-z0-9-]
     */
    public String schemaFor(String tenantId) {
        if (tenantId == null || tenantId.trim().isEmpty()) {
            throw new NoTenantContextException("schema lookup");
        }
        if (!SCHEMA_SAFE_ID.matcher(tenantId).matches()) {
            throw new IllegalArgumentException("Tenant id cannot name a schema: " + tenantId);
        }
        return SCHEMA_PREFIX + tenantId.replace('-', '_');
    }
    
    @Override
    public IsolationMode getMode() {
        return IsolationMode.SCHEMA_PER_TENANT;
    }
}
