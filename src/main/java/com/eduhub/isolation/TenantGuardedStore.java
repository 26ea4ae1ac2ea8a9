package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import com.eduhub.security.NoTenantContextException;
import com.eduhub.security.TenantContextHolder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Enforces tenant isolation around a storage backend.
 *
 * Every call re-validates against the tenant bound in
 * {@link TenantContextHolder}, so a missing filter anywhere in application
 * code cannot leak data between tenants:
 * - Writes stamp an unset tenant id from the context and refuse a record
 *   that names another tenant ({@link CrossTenantWriteException}).
 * - Reads and deletes get an equality filter on the context tenant. A caller
 *   filter on the same tenant is accepted; one naming another tenant is
 *   refused ({@link CrossTenantReadException}, or
 *   {@link CrossTenantWriteException} for deletes).
 * - Records coming back from the backend are checked again, which also
 *   covers backends that rely on storage-level row policies.
 * - Without a bound context every operation fails with
 *   {@link NoTenantContextException}; there is no default tenant.
 *
 * Violations are logged at ERROR level, counted and rethrown. They are never
 * corrected silently.
 *
 * @param <T> the record type
 */
public class TenantGuardedStore<T extends TenantOwned> implements RecordStore<T> {
    
    private static final Logger log = LoggerFactory.getLogger(TenantGuardedStore.class);
    
    static final String VIOLATIONS_METRIC = "eduhub.isolation.violations";
    
    private final RecordStore<T> delegate;
    private final String recordType;
    private final Counter writeViolations;
    private final Counter readViolations;
    private final Counter missingContext;
    
    public TenantGuardedStore(RecordStore<T> delegate, String recordType, MeterRegistry meterRegistry) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.recordType = recordType;
        this.writeViolations = violationCounter(meterRegistry, "cross_tenant_write");
        this.readViolations = violationCounter(meterRegistry, "cross_tenant_read");
        this.missingContext = violationCounter(meterRegistry, "no_tenant_context");
    }
    
    @Override
    public T insert(T record) {
        String tenantId = currentTenant("insert");
        stampOrVerify(record, tenantId);
        T stored = delegate.insert(record);
        verifyReturned(stored, tenantId);
        return stored;
    }
    
    @Override
    public Optional<T> update(T record) {
        String tenantId = currentTenant("update");
        stampOrVerify(record, tenantId);
        Optional<T> stored = delegate.update(record);
        stored.ifPresent(r -> verifyReturned(r, tenantId));
        return stored;
    }
    
    @Override
    public List<T> find(RecordQuery query) {
        String tenantId = currentTenant("find");
        List<T> results = delegate.find(scopeRead(query, tenantId));
        results.forEach(r -> verifyReturned(r, tenantId));
        return results;
    }
    
    @Override
    public Optional<T> findOne(RecordQuery query) {
        String tenantId = currentTenant("findOne");
        Optional<T> result = delegate.findOne(scopeRead(query, tenantId));
        result.ifPresent(r -> verifyReturned(r, tenantId));
        return result;
    }
    
    @Override
    public long count(RecordQuery query) {
        String tenantId = currentTenant("count");
        return delegate.count(scopeRead(query, tenantId));
    }
    
    @Override
    public int delete(RecordQuery query) {
        String tenantId = currentTenant("delete");
        if (query.hasTenantFilter() && !tenantId.equals(query.tenantId())) {
            writeViolations.increment();
            log.error("Cross-tenant delete blocked: tenant '{}' attempted to delete {} of tenant '{}'",
                tenantId, recordType, query.tenantId());
            throw new CrossTenantWriteException(tenantId, query.tenantId(), recordType);
        }
        return delegate.delete(query.hasTenantFilter() ? query : query.withTenant(tenantId));
    }
    
    public String getRecordType() {
        return recordType;
    }
    
    private String currentTenant(String operation) {
        return TenantContextHolder.current()
            .map(context -> context.getTenantId())
            .orElseThrow(() -> {
                missingContext.increment();
                log.error("Tenant-scoped {} on {} attempted without a tenant context", operation, recordType);
                return new NoTenantContextException(operation + " " + recordType);
            });
    }
    
    private void stampOrVerify(T record, String tenantId) {
        if (record == null) {
            throw new IllegalArgumentException(recordType + " must not be null");
        }
        if (record.getTenantId() == null) {
            record.setTenantId(tenantId);
            return;
        }
        if (!tenantId.equals(record.getTenantId())) {
            writeViolations.increment();
            log.error("Cross-tenant write blocked: tenant '{}' attempted to write {} {} of tenant '{}'",
                tenantId, recordType, record.getId(), record.getTenantId());
            throw new CrossTenantWriteException(tenantId, record.getTenantId(), recordType);
        }
    }
    
    private RecordQuery scopeRead(RecordQuery query, String tenantId) {
        if (query == null) {
            throw new IllegalArgumentException("Query must not be null");
        }
        if (!query.hasTenantFilter()) {
            return query.withTenant(tenantId);
        }
        if (tenantId.equals(query.tenantId())) {
            return query;
        }
        readViolations.increment();
        log.error("Cross-tenant read blocked: tenant '{}' attempted to query {} of tenant '{}'",
            tenantId, recordType, query.tenantId());
        throw new CrossTenantReadException(tenantId, query.tenantId(), recordType);
    }
    
    private void verifyReturned(T record, String tenantId) {
        if (record != null && !tenantId.equals(record.getTenantId())) {
            readViolations.increment();
            log.error("Storage returned {} {} of tenant '{}' to tenant '{}'",
                recordType, record.getId(), record.getTenantId(), tenantId);
            throw new CrossTenantReadException(tenantId, record.getTenantId(), recordType);
        }
    }
    
    private Counter violationCounter(MeterRegistry meterRegistry, String type) {
        return Counter.builder(VIOLATIONS_METRIC)
            .description("Tenant isolation violations blocked by the data access guard")
            .tag("record", recordType)
            .tag("type", type)
            .register(meterRegistry);
    }
}
