package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;

import java.util.List;
import java.util.Optional;

/**
 * Storage access for one type of tenant-owned record.
 * 
 * Implemented by storage backends and by {@link TenantGuardedStore}, which
 * wraps a backend and enforces tenant isolation around it. Application code
 * only ever holds the guarded variant.
 *
 * @param <T> the record type
 */
public interface RecordStore<T extends TenantOwned> {
    
    /**
     * Persist a new record. An identifier is assigned when the record has none.
     * 
     * @return the stored record
     */
    T insert(T record);
    
    /**
     * Replace an existing record of the same tenant. The tenant of a stored
     * record never changes.
     * 
     * @return the stored record, or empty if no record with that id exists for the record's tenant
     */
    Optional<T> update(T record);
    
    List<T> find(RecordQuery query);
    
    default Optional<T> findOne(RecordQuery query) {
        return find(query.limit(1)).stream().findFirst();
    }
    
    long count(RecordQuery query);
    
    /**
     * @return the number of records deleted
     */
    int delete(RecordQuery query);
}
