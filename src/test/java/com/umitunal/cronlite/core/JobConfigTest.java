package com.umitunal.cronlite.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobConfigTest {

    @Test
    @DisplayName("Should read typed values with defaults")
    void testTypedAccess() {
        JobConfig config = JobConfig.of("retentionDays", 14)
                .with("dryRun", "true")
                .with("url", "http://example.test");

        assertThat(config.getInt("retentionDays", 30)).isEqualTo(14);
        assertThat(config.getInt("missing", 30)).isEqualTo(30);
        assertThat(config.getBoolean("dryRun", false)).isTrue();
        assertThat(config.getString("url", null)).isEqualTo("http://example.test");
        assertThat(config.getString("missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    @DisplayName("Should reject non-numeric integers")
    void testInvalidInt() {
        JobConfig config = JobConfig.of("retentionDays", "thirty");

        assertThatThrownBy(() -> config.getInt("retentionDays", 30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retentionDays");
    }

    @Test
    @DisplayName("Should read lists and treat a scalar as one element")
    void testStringList() {
        JobConfig config = JobConfig.of("targets", List.of("/a", "/b")).with("single", "/c");

        assertThat(config.getStringList("targets")).containsExactly("/a", "/b");
        assertThat(config.getStringList("single")).containsExactly("/c");
        assertThat(config.getStringList("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should not be affected by changes to the copy")
    void testCopyOnWrite() {
        JobConfig original = JobConfig.of("a", 1);
        JobConfig changed = original.with("b", 2);

        assertThat(original.size()).isEqualTo(1);
        assertThat(changed.size()).isEqualTo(2);
        assertThat(original.asMap()).isEqualTo(Map.of("a", 1));
        assertThatThrownBy(() -> changed.asMap().put("c", 3))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
