package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;

/**
 * Creates the storage backend for a record type. One implementation is
 * active per deployment, selected by {@code eduhub.storage.backend}.
 */
public interface RecordStoreFactory {
    
    <T extends TenantOwned> RecordStore<T> create(Class<T> type, RecordMapping<T> mapping);
}
