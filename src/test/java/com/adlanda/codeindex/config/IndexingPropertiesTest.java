package com.adlanda.codeindex.config;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexingPropertiesTest {

    @Test
    void limits_resolve_appliesDefaultAndBounds() {
        IndexingProperties.Limits limits = new IndexingProperties.Limits(50, 1000);

        assertThat(limits.resolve(null)).isEqualTo(50);
        assertThat(limits.resolve(1000)).isEqualTo(1000);
        assertThatThrownBy(() -> limits.resolve(1001))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("limit must be between 1 and 1000, got 1001");
        assertThatThrownBy(() -> limits.resolve(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isSkipped_matchesLowercasedExtension() {
        IndexingProperties properties = new IndexingProperties();

        assertThat(properties.isSkipped("assets/Logo.PNG")).isTrue();
        assertThat(properties.isSkipped("lib/native.so")).isTrue();
        assertThat(properties.isSkipped("src/Main.java")).isFalse();
        assertThat(properties.isSkipped("Makefile")).isFalse();
        assertThat(properties.isSkipped("dir.png/README")).isFalse();
    }

    @Test
    void setSkipExtensions_normalizesEntries() {
        IndexingProperties properties = new IndexingProperties();

        properties.setSkipExtensions(Set.of("LOCK", ".Map"));

        assertThat(properties.getSkipExtensions()).containsExactlyInAnyOrder(".lock", ".map");
        assertThat(properties.isSkipped("yarn.lock")).isTrue();
        assertThat(properties.isSkipped("logo.png")).isFalse();
    }
}
