package com.eduhub.isolation;

/**
 * Resolves the physical table holding a tenant's records.
 */
public interface TableLocator {
    
    /**
     * @param table the unqualified table name
     * @param tenantId the tenant being accessed
     * @return the table reference to use in SQL
     */
    String locate(String table, String tenantId);
    
    IsolationMode getMode();
}
