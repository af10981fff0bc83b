package org.carball.dpm.generation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameRegistryTest {

    @Test
    void shouldAppendFirstFreeSuffixOnCollision() {
        // Given
        NameRegistry registry = new NameRegistry("Item");

        // When / Then
        assertThat(registry.claim("category")).isEqualTo("category");
        assertThat(registry.claim("category")).isEqualTo("category2");
        assertThat(registry.claim("category")).isEqualTo("category3");
    }

    @Test
    void shouldTreatNamesCaseInsensitively() {
        // Given
        NameRegistry registry = new NameRegistry("Dpm", List.of("References"));

        // When / Then
        assertThat(registry.isTaken("references")).isTrue();
        assertThat(registry.claim("REFERENCES")).isEqualTo("REFERENCES2");
    }
}
