package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Creates {@link JdbcRecordStore}s that share one {@link JdbcTemplate} and
 * one table layout.
 */
public class JdbcRecordStoreFactory implements RecordStoreFactory {
    
    private final JdbcTemplate jdbcTemplate;
    private final TableLocator tableLocator;
    
    public JdbcRecordStoreFactory(JdbcTemplate jdbcTemplate, TableLocator tableLocator) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableLocator = tableLocator;
    }
    
    @Override
    public <T extends TenantOwned> RecordStore<T> create(Class<T> type, RecordMapping<T> mapping) {
        return new JdbcRecordStore<>(jdbcTemplate, mapping, tableLocator);
    }
}
