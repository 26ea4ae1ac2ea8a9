package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Record storage in a relational database through {@link JdbcTemplate}.
 *
 * Only fields whitelisted by the {@link RecordMapping} can appear in SQL;
 * values are always bound as parameters. Updates never touch the id or
 * tenant_id columns and match on both, so a stored record cannot move to
 * another tenant.
 *
 * @param <T> the record type
 */
public class JdbcRecordStore<T extends TenantOwned> implements RecordStore<T> {
    
    private static final Logger logger = LoggerFactory.getLogger(JdbcRecordStore.class);
    
    private final JdbcTemplate jdbcTemplate;
    private final RecordMapping<T> mapping;
    private final TableLocator tableLocator;
    
    public JdbcRecordStore(JdbcTemplate jdbcTemplate, RecordMapping<T> mapping, TableLocator tableLocator) {
        this.jdbcTemplate = jdbcTemplate;
        this.mapping = mapping;
        this.tableLocator = tableLocator;
    }
    
    @Override
    public T insert(T record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        Map<String, Object> columns = mapping.toColumns(record);
        String table = tableLocator.locate(mapping.getTableName(), record.getTenantId());
        
        String sql = "INSERT INTO " + table
            + " (" + String.join(", ", columns.keySet()) + ")"
            + " VALUES (" + columns.keySet().stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
        
        jdbcTemplate.update(sql, columns.values().toArray());
        logger.debug("Inserted {} {} for tenant {}", mapping.getTableName(), record.getId(), record.getTenantId());
        return record;
    }
    
    @Override
    public Optional<T> update(T record) {
        if (record.getId() == null) {
            return Optional.empty();
        }
        Map<String, Object> columns = new LinkedHashMap<>(mapping.toColumns(record));
        columns.remove(RecordMapping.ID_COLUMN);
        columns.remove(RecordMapping.TENANT_COLUMN);
        String table = tableLocator.locate(mapping.getTableName(), record.getTenantId());
        
        String sql = "UPDATE " + table
            + " SET " + columns.keySet().stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
            + " WHERE " + RecordMapping.ID_COLUMN + " = ? AND " + RecordMapping.TENANT_COLUMN + " = ?";
        
        List<Object> args = new ArrayList<>(columns.values());
        args.add(record.getId());
        args.add(record.getTenantId());
        
        int rows = jdbcTemplate.update(sql, args.toArray());
        return rows > 0 ? Optional.of(record) : Optional.empty();
    }
    
    @Override
    public List<T> find(RecordQuery query) {
        Where where = where(query);
        StringBuilder sql = new StringBuilder()
            .append("SELECT * FROM ").append(table(query))
            .append(where.clause)
            .append(" ORDER BY ").append(RecordMapping.ID_COLUMN);
        
        List<Object> args = new ArrayList<>(where.args);
        if (query.getLimit() != null) {
            sql.append(" LIMIT ?");
            args.add(query.getLimit());
        }
        if (query.getOffset() > 0) {
            sql.append(" OFFSET ?");
            args.add(query.getOffset());
        }
        
        long start = System.currentTimeMillis();
        List<T> results = jdbcTemplate.query(sql.toString(), mapping.getRowMapper(), args.toArray());
        logger.debug("Query on {} returned {} rows in {} ms", mapping.getTableName(), results.size(),
            System.currentTimeMillis() - start);
        return results;
    }
    
    @Override
    public long count(RecordQuery query) {
        Where where = where(query);
        String sql = "SELECT COUNT(*) FROM " + table(query) + where.clause;
        Long count = jdbcTemplate.queryForObject(sql, Long.class, where.args.toArray());
        return count != null ? count : 0L;
    }
    
    @Override
    public int delete(RecordQuery query) {
        Where where = where(query);
        String sql = "DELETE FROM " + table(query) + where.clause;
        return jdbcTemplate.update(sql, where.args.toArray());
    }
    
    private String table(RecordQuery query) {
        return tableLocator.locate(mapping.getTableName(), query.tenantId());
    }
    
    private Where where(RecordQuery query) {
        List<String> conditions = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        query.getCriteria().forEach((field, value) -> {
            conditions.add(mapping.columnFor(field) + " = ?");
            args.add(value instanceof Enum<?> ? value.toString() : value);
        });
        String clause = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
        return new Where(clause, args);
    }
    
    private static final class Where {
        private final String clause;
        private final List<Object> args;
        
        private Where(String clause, List<Object> args) {
            this.clause = clause;
            this.args = args;
        }
    }
}
