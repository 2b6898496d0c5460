package com.umitunal.cronlite.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JobTypeTest {

    @Test
    @DisplayName("Should resolve every tag back to its type")
    void testFromTag() {
        for (JobType type : JobType.values()) {
            assertThat(JobType.fromTag(type.getTag())).isSameAs(type);
        }
        assertThat(JobType.fromTag("duplicate_detection")).isEqualTo(JobType.DUPLICATE_DETECTION);
    }

    @Test
    @DisplayName("Should reject unknown tags")
    void testUnknownTag() {
        assertThatThrownBy(() -> JobType.fromTag("reindex"))
                .isInstanceOf(UnknownJobTypeException.class)
                .hasMessageContaining("reindex");
        assertThatThrownBy(() -> JobType.fromTag("CLEANUP"))
                .isInstanceOf(UnknownJobTypeException.class);
    }
}
