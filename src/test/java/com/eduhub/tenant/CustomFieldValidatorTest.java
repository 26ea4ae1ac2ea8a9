package com.eduhub.tenant;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CustomFieldValidator Tests")
class CustomFieldValidatorTest {
    
    private final CustomFieldValidator validator = new CustomFieldValidator(new ObjectMapper());
    
    private static Map<String, Object> config() {
        return Map.of(CustomFieldValidator.CONFIG_KEY, Map.of("student", List.of(
            Map.of("name", "house", "type", "string", "required", true),
            Map.of("name", "lockerNumber", "type", "number"),
            Map.of("name", "enrolledOn", "type", "date"),
            Map.of("name", "boarder", "type", "boolean"))));
    }
    
    @Test
    @DisplayName("Should accept values matching the tenant schema")
    void shouldAcceptValidValues() {
        Map<String, Object> values = Map.of(
            "house", "Ravenclaw",
            "lockerNumber", 42,
            "enrolledOn", "2025-09-01",
            "boarder", true);
        
        assertThat(validator.validate(config(), "student", values)).isEqualTo(values);
    }
    
    @Test
    @DisplayName("Should reject unknown fields")
    void shouldRejectUnknownField() {
        assertThatThrownBy(() -> validator.validate(config(), "student", Map.of("house", "Hufflepuff", "shoeSize", 9)))
            .isInstanceOfSatisfying(InvalidCustomFieldException.class,
                e -> assertThat(e.getField()).isEqualTo("shoeSize"));
    }
    
    @Test
    @DisplayName("Should reject type mismatches")
    void shouldRejectWrongType() {
        assertThatThrownBy(() -> validator.validate(config(), "student", Map.of("house", "Slytherin", "enrolledOn", "yesterday")))
            .isInstanceOf(InvalidCustomFieldException.class)
            .hasMessageContaining("date");
        assertThatThrownBy(() -> validator.validate(config(), "student", Map.of("house", 7)))
            .isInstanceOf(InvalidCustomFieldException.class);
    }
    
    @Test
    @DisplayName("Should require required fields, including when sent as null")
    void shouldEnforceRequired() {
        Map<String, Object> nullHouse = new HashMap<>();
        nullHouse.put("house", null);
        
        assertThatThrownBy(() -> validator.validate(config(), "student", Map.of()))
            .isInstanceOf(InvalidCustomFieldException.class);
        assertThatThrownBy(() -> validator.validate(config(), "student", nullHouse))
            .isInstanceOf(InvalidCustomFieldException.class);
    }
    
    @Test
    @DisplayName("Should reject any custom field when the tenant defines none")
    void shouldRejectWithoutSchema() {
        assertThat(validator.validate(Map.of(), "student", null)).isEmpty();
        assertThatThrownBy(() -> validator.validate(Map.of(), "student", Map.of("house", "Gryffindor")))
            .isInstanceOf(InvalidCustomFieldException.class);
    }
    
    @Test
    @DisplayName("Should report a malformed schema as a server-side fault")
    void shouldFailOnMalformedSchema() {
        Map<String, Object> broken = Map.of(CustomFieldValidator.CONFIG_KEY, Map.of("student", "not-a-list"));
        
        assertThatThrownBy(() -> validator.validate(broken, "student", Map.of()))
            .isInstanceOf(IllegalStateException.class);
    }
}
