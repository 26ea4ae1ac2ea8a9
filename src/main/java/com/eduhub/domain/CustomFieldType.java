package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Value types allowed in a tenant's custom field schema.
 */
public enum CustomFieldType {
    
    STRING("string") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }
    },
    NUMBER("number") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Number;
        }
    },
    BOOLEAN("boolean") {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Boolean;
        }
    },
    /**
     * ISO-8601 calendar date carried as a string, e.g. "2024-09-01"
     */
    DATE("date") {
        @Override
        public boolean accepts(Object value) {
            if (!(value instanceof String)) {
                return false;
            }
            try {
                LocalDate.parse((String) value);
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    };
    
    private final String value;
    
    CustomFieldType(String value) {
        this.value = value;
    }
    
    /**
     * @param value a deserialized JSON value, never null
     * @return true if the value is of this type
     */
    public abstract boolean accepts(Object value);
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @JsonCreator
    public static CustomFieldType fromValue(String value) {
        for (CustomFieldType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown custom field type: " + value);
    }
}
