package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of consumption tracked per tenant.
 * 
 * Windowed kinds reset at the end of each UTC day; cumulative kinds
 * persist until explicitly released.
 */
public enum ResourceKind {
    
    API_CALLS("api_calls", true),
    STORAGE_BYTES("storage_bytes", false),
    USERS("users", false),
    STUDENTS("students", false);
    
    private final String value;
    private final boolean windowed;
    
    ResourceKind(String value, boolean windowed) {
        this.value = value;
        this.windowed = windowed;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * @return true if the counter for this kind expires at the end of a daily window
     */
    public boolean isWindowed() {
        return windowed;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
