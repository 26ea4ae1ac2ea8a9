package com.eduhub.isolation;

import com.eduhub.security.NoTenantContextException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Table locators")
class SchemaPerTenantLocatorTest {
    
    private final SchemaPerTenantLocator locator = new SchemaPerTenantLocator();
    
    @Test
    @DisplayName("should derive the schema name from the tenant id")
    void shouldDeriveSchemaName() {
        assertThat(locator.schemaFor("3f2b-acme")).isEqualTo("tenant_3f2b_acme");
        assertThat(locator.schemaFor("6f1c0d2e-8a4b-4c1e-9f3a-2b7d5e9c1a00"))
            .isEqualTo("tenant_6f1c0d2e_8a4b_4c1e_9f3a_2b7d5e9c1a00");
        assertThat(locator.locate("students", "acme")).isEqualTo("tenant_acme.students");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"a_b", "A-B", "acme.edu", " acme", "x\"; drop schema public; --"})
    @DisplayName("should reject tenant ids that could collide or escape the schema name")
    void shouldRejectUnsafeIds(String tenantId) {
        assertThatThrownBy(() -> locator.schemaFor(tenantId)).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("should keep distinct ids in distinct schemas")
    void shouldNotFoldDistinctIds() {
        assertThat(locator.schemaFor("a-b")).isNotEqualTo(locator.schemaFor("ab"));
        assertThatThrownBy(() -> locator.schemaFor("a_b")).isInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    @DisplayName("should refuse to locate tables without a tenant")
    void shouldRequireTenant() {
        assertThatThrownBy(() -> locator.locate("students", null)).isInstanceOf(NoTenantContextException.class);
    }
    
    @Test
    @DisplayName("should use the bare table in shared-table mode")
    void shouldUseSharedTable() {
        SharedTableLocator shared = new SharedTableLocator();
        
        assertThat(shared.locate("students", "acme")).isEqualTo("students");
        assertThat(shared.getMode()).isEqualTo(IsolationMode.SHARED_TABLE);
    }
}
