package com.eduhub.tenant;

import com.eduhub.domain.CustomFieldDefinition;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks custom field values against the schema a tenant keeps in its
 * config under {@code customFields.<entity>}.
 *
 * A map passes only if every key is defined, every value has the defined
 * type and every required field is present. Without a schema for the
 * entity, no custom fields are accepted.
 */
@Component
public class CustomFieldValidator {
    
    public static final String CONFIG_KEY = "customFields";
    
    private static final TypeReference<List<CustomFieldDefinition>> DEFINITIONS = new TypeReference<>() {
    };
    
    private final ObjectMapper objectMapper;
    
    public CustomFieldValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    /**
     * @param tenantConfig the tenant config snapshot
     * @param entity the entity name, e.g. "student"
     * @param values the submitted custom fields, may be null
     * @return the validated fields, never null
     * @throws InvalidCustomFieldException on the first violation found
     */
    public Map<String, Object> validate(Map<String, Object> tenantConfig, String entity, Map<String, Object> values) {
        Map<String, CustomFieldDefinition> schema = schemaFor(tenantConfig, entity);
        Map<String, Object> submitted = values != null ? values : Collections.emptyMap();
        
        for (Map.Entry<String, Object> entry : submitted.entrySet()) {
            CustomFieldDefinition definition = schema.get(entry.getKey());
            if (definition == null) {
                throw new InvalidCustomFieldException(entry.getKey(),
                    "Unknown custom field '" + entry.getKey() + "' for " + entity);
            }
            Object value = entry.getValue();
            if (value == null) {
                if (definition.isRequired()) {
                    throw new InvalidCustomFieldException(entry.getKey(), "Custom field '" + entry.getKey() + "' is required");
                }
                continue;
            }
            if (!definition.getType().accepts(value)) {
                throw new InvalidCustomFieldException(entry.getKey(),
                    "Custom field '" + entry.getKey() + "' must be of type " + definition.getType().getValue());
            }
        }
        
        for (CustomFieldDefinition definition : schema.values()) {
            if (definition.isRequired() && !submitted.containsKey(definition.getName())) {
                throw new InvalidCustomFieldException(definition.getName(),
                    "Custom field '" + definition.getName() + "' is required");
            }
        }
        return new LinkedHashMap<>(submitted);
    }
    
    Map<String, CustomFieldDefinition> schemaFor(Map<String, Object> tenantConfig, String entity) {
        if (tenantConfig == null || !(tenantConfig.get(CONFIG_KEY) instanceof Map)) {
            return Collections.emptyMap();
        }
        Object raw = ((Map<?, ?>) tenantConfig.get(CONFIG_KEY)).get(entity);
        if (raw == null) {
            return Collections.emptyMap();
        }
        
        List<CustomFieldDefinition> definitions;
        try {
            definitions = objectMapper.convertValue(raw, DEFINITIONS);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Malformed custom field schema for " + entity, e);
        }
        
        Map<String, CustomFieldDefinition> schema = new LinkedHashMap<>();
        for (CustomFieldDefinition definition : definitions) {
            if (definition.getName() != null && definition.getType() != null) {
                schema.put(definition.getName(), definition);
            }
        }
        return schema;
    }
}
