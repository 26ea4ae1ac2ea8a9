package com.eduhub.config;

import com.eduhub.isolation.IsolationMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JdbcStorageConfig")
class JdbcStorageConfigTest {
    
    @Test
    @DisplayName("should accept isolation modes in property notation")
    void shouldParseModes() {
        assertThat(JdbcStorageConfig.parseMode("shared-table")).isEqualTo(IsolationMode.SHARED_TABLE);
        assertThat(JdbcStorageConfig.parseMode(" Schema-Per-Tenant ")).isEqualTo(IsolationMode.SCHEMA_PER_TENANT);
    }
    
    @Test
    @DisplayName("should reject unknown isolation modes")
    void shouldRejectUnknownMode() {
        assertThatThrownBy(() -> JdbcStorageConfig.parseMode("database-per-tenant"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("eduhub.isolation.mode");
    }
}
