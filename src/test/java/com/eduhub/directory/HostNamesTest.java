package com.eduhub.directory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HostNames")
class HostNamesTest {
    
    @Test
    @DisplayName("should lower-case, trim and drop trailing dot")
    void shouldNormalize() {
        assertThat(HostNames.normalize("  Acme.EduHub.IO. ")).isEqualTo("acme.eduhub.io");
        assertThat(HostNames.normalize("   ")).isNull();
        assertThat(HostNames.normalize(null)).isNull();
    }
    
    @Test
    @DisplayName("should strip port from host names and IPv6 literals")
    void shouldStripPort() {
        assertThat(HostNames.stripPort("acme.eduhub.io:8443")).isEqualTo("acme.eduhub.io");
        assertThat(HostNames.stripPort("Acme.EduHub.io")).isEqualTo("acme.eduhub.io");
        assertThat(HostNames.stripPort("[::1]:8080")).isEqualTo("[::1]");
    }
}
