package com.eduhub.isolation;

/**
 * All tenants share one table per record type.
 */
public class SharedTableLocator implements TableLocator {
    
    @Override
    public String locate(String table, String tenantId) {
        return table;
    }
    
    @Override
    public IsolationMode getMode() {
        return IsolationMode.SHARED_TABLE;
    }
}
