package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Creates {@link InMemoryRecordStore}s. The relational mapping is ignored.
 */
public class InMemoryRecordStoreFactory implements RecordStoreFactory {
    
    private final ObjectMapper objectMapper;
    
    public InMemoryRecordStoreFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    @Override
    public <T extends TenantOwned> RecordStore<T> create(Class<T> type, RecordMapping<T> mapping) {
        return new InMemoryRecordStore<>(type, objectMapper);
    }
}
