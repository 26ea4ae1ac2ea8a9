package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-to-column whitelist plus JSON helpers for extension columns.
 */
public abstract class AbstractRecordMapping<T extends TenantOwned> implements RecordMapping<T> {
    
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    
    private final String tableName;
    private final Map<String, String> columnsByField;
    protected final ObjectMapper objectMapper;
    
    protected AbstractRecordMapping(String tableName, Map<String, String> columnsByField, ObjectMapper objectMapper) {
        this.tableName = tableName;
        this.columnsByField = new LinkedHashMap<>(columnsByField);
        this.columnsByField.put(RecordQuery.ID_FIELD, ID_COLUMN);
        this.columnsByField.put(TenantOwned.TENANT_FIELD, TENANT_COLUMN);
        this.objectMapper = objectMapper;
    }
    
    @Override
    public String getTableName() {
        return tableName;
    }
    
    @Override
    public String columnFor(String field) {
        String column = columnsByField.get(field);
        if (column == null) {
            throw new IllegalArgumentException("Unknown field '" + field + "' for table " + tableName);
        }
        return column;
    }
    
    protected String writeJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value != null ? value : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Custom fields are not serializable", e);
        }
    }
    
    protected Map<String, Object> readJson(String json) {
        if (json == null || json.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt custom fields column in " + tableName, e);
        }
    }
}
