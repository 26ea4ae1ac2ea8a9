package com.eduhub.isolation;

import com.eduhub.domain.TenantOwned;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Record storage held in process memory, in insertion order.
 *
 * Records are copied on the way in and out through Jackson, so callers
 * never share instances with the store. Query criteria are matched against
 * the records' JSON properties.
 *
 * @param <T> the record type
 */
public class InMemoryRecordStore<T extends TenantOwned> implements RecordStore<T> {
    
    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Set<String> fields;
    private final Map<String, T> records = new LinkedHashMap<>();
    
    public InMemoryRecordStore(Class<T> type, ObjectMapper objectMapper) {
        this.type = type;
        this.objectMapper = objectMapper;
        this.fields = objectMapper.getSerializationConfig()
            .introspect(objectMapper.constructType(type))
            .findProperties().stream()
            .map(BeanPropertyDefinition::getName)
            .collect(Collectors.toUnmodifiableSet());
    }
    
    @Override
    public synchronized T insert(T record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        if (records.containsKey(record.getId())) {
            throw new IllegalArgumentException(type.getSimpleName() + " already exists: " + record.getId());
        }
        records.put(record.getId(), copy(record));
        return copy(record);
    }
    
    @Override
    public synchronized Optional<T> update(T record) {
        if (record.getId() == null) {
            return Optional.empty();
        }
        T existing = records.get(record.getId());
        if (existing == null || !Objects.equals(existing.getTenantId(), record.getTenantId())) {
            return Optional.empty();
        }
        records.put(record.getId(), copy(record));
        return Optional.of(copy(record));
    }
    
    @Override
    public synchronized List<T> find(RecordQuery query) {
        Stream<T> matches = records.values().stream()
            .filter(record -> matches(record, query))
            .skip(query.getOffset());
        if (query.getLimit() != null) {
            matches = matches.limit(query.getLimit());
        }
        return matches.map(this::copy).collect(Collectors.toList());
    }
    
    @Override
    public synchronized long count(RecordQuery query) {
        return records.values().stream().filter(record -> matches(record, query)).count();
    }
    
    @Override
    public synchronized int delete(RecordQuery query) {
        List<String> removed = new ArrayList<>();
        Iterator<T> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            T record = iterator.next();
            if (matches(record, query)) {
                removed.add(record.getId());
                iterator.remove();
            }
        }
        return removed.size();
    }
    
    private boolean matches(T record, RecordQuery query) {
        JsonNode node = objectMapper.valueToTree(record);
        for (Map.Entry<String, Object> criterion : query.getCriteria().entrySet()) {
            if (!fields.contains(criterion.getKey())) {
                throw new IllegalArgumentException(
                    "Unknown field '" + criterion.getKey() + "' for " + type.getSimpleName());
            }
            JsonNode actual = node.get(criterion.getKey());
            JsonNode expected = objectMapper.valueToTree(criterion.getValue());
            if (!sameValue(actual, expected)) {
                return false;
            }
        }
        return true;
    }
    
    private static boolean sameValue(JsonNode actual, JsonNode expected) {
        if (actual == null || actual.isNull()) {
            return false;
        }
        if (actual.isValueNode() && expected.isValueNode()) {
            return actual.asText().equals(expected.asText());
        }
        return actual.equals(expected);
    }
    
    private T copy(T record) {
        return objectMapper.convertValue(record, type);
    }
}
