package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable equality query over tenant-owned records.
 * 
 * Criteria name logical fields ("gradeLevel", "tenantId"); backends map
 * them to their own representation and reject fields they do not know.
 */
public final class RecordQuery {
    
    public static final String ID_FIELD = "id";
    
    private final Map<String, Object> criteria;
    private final Integer limit;
    private final int offset;
    
    private RecordQuery(Map<String, Object> criteria, Integer limit, int offset) {
        this.criteria = Collections.unmodifiableMap(criteria);
        this.limit = limit;
        this.offset = offset;
    }
    
    public static RecordQuery all() {
        return new RecordQuery(new LinkedHashMap<>(), null, 0);
    }
    
    public static RecordQuery where(String field, Object value) {
        return all().and(field, value);
    }
    
    public static RecordQuery byId(String id) {
        return where(ID_FIELD, id);
    }
    
    /**
     * @throws IllegalArgumentException if field or value is null
     */
    public RecordQuery and(String field, Object value) {
        if (field == null || value == null) {
            throw new IllegalArgumentException("Query field and value must not be null");
        }
        Map<String, Object> next = new LinkedHashMap<>(criteria);
        next.put(field, value);
        return new RecordQuery(next, limit, offset);
    }
    
    /**
     * Add a criterion only when a value is given.
     */
    public RecordQuery andIfPresent(String field, Object value) {
        return value == null ? this : and(field, value);
    }
    
    public RecordQuery limit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return new RecordQuery(new LinkedHashMap<>(criteria), limit, offset);
    }
    
    public RecordQuery offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return new RecordQuery(new LinkedHashMap<>(criteria), limit, offset);
    }
    
    /**
     * @return the tenant filter supplied with this query, or null
     */
    public String tenantId() {
        Object value = criteria.get(TenantOwned.TENANT_FIELD);
        return value == null ? null : value.toString();
    }
    
    public boolean hasTenantFilter() {
        return criteria.containsKey(TenantOwned.TENANT_FIELD);
    }
    
    /**
     * @return a copy of this query filtered on the given tenant
     */
    public RecordQuery withTenant(String tenantId) {
        return and(TenantOwned.TENANT_FIELD, tenantId);
    }
    
    public Map<String, Object> getCriteria() {
        return criteria;
    }
    
    /**
     * @return the maximum number of results, or null for no limit
     */
    public Integer getLimit() {
        return limit;
    }
    
    public int getOffset() {
        return offset;
    }
    
    @Override
    public String toString() {
        return "RecordQuery{criteria=" + criteria + ", limit=" + limit + ", offset=" + offset + '}';
    }
}
