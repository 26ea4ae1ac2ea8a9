package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import org.springframework.jdbc.core.RowMapper;

import java.util.Map;

/**
 * Relational mapping of one record type.
 *
 * @param <T> the record type
 */
public interface RecordMapping<T extends TenantOwned> {
    
    String ID_COLUMN = "id";
    String TENANT_COLUMN = "tenant_id";
    
    /**
     * @return the unqualified table name
     */
    String getTableName();
    
    /**
     * Translate a logical query field to its column.
     * 
     * @throws IllegalArgumentException if the field is not mapped
     */
    String columnFor(String field);
    
    /**
     * @return column values of the record, including id and tenant_id, in insert order
     */
    Map<String, Object> toColumns(T record);
    
    RowMapper<T> getRowMapper();
}
