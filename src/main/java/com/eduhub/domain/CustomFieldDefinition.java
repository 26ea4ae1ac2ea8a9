package com.eduhub.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a tenant's custom field schema for an entity type.
 * 
 * Schemas live in the tenant config under {@code customFields.<entity>},
 * e.g. {@code customFields.student}.
 */
public class CustomFieldDefinition {
    
    @JsonProperty("name")
    private String name;
    
    @JsonProperty("type")
    private CustomFieldType type;
    
    @JsonProperty("required")
    private boolean required;
    
    public CustomFieldDefinition() {
    }
    
    public CustomFieldDefinition(String name, CustomFieldType type, boolean required) {
        this.name = name;
        this.type = type;
        this.required = required;
    }
    
    public String getName() {
        return name;
    }
    
    public void setName(String name) {
        this.name = name;
    }
    
    public CustomFieldType getType() {
        return type;
    }
    
    public void setType(CustomFieldType type) {
        this.type = type;
    }
    
    public boolean isRequired() {
        return required;
    }
    
    public void setRequired(boolean required) {
        this.required = required;
    }
}
