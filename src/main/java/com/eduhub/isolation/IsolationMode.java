package com.eduhub.isolation;

/**
 * How tenant data is laid out in a relational store. One mode is chosen
 * per deployment.
 */
public enum IsolationMode {
    
    /**
     * All tenants share each table; rows carry a tenant_id column.
     */
    SHARED_TABLE,
    
    /**
     * Each tenant has its own schema holding the same tables.
     */
    SCHEMA_PER_TENANT
}
