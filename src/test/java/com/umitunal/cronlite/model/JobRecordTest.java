package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobPatch;
import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class JobRecordTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant LATER = CREATED.plusSeconds(60);

    private JobRecord scheduledJob() {
        JobRecord record = new JobRecord("job-1", "owner-1", "cleanup", JobType.CLEANUP,
                "0 3 * * *", JobConfig.empty(), true, CREATED);
        record.markNextRun(Instant.parse("2024-05-02T03:00:00Z"), CREATED);
        return record;
    }

    @Test
    @DisplayName("Should pause and clear next run when deactivated")
    void testDeactivate() {
        JobRecord record = scheduledJob();

        record.apply(JobPatch.newBuilder().withActive(false).build(), LATER);

        assertThat(record.isActive()).isFalse();
        assertThat(record.getStatus()).isEqualTo(Job.Status.PAUSED);
        assertThat(record.getNextRun()).isNull();
        assertThat(record.getUpdatedAt()).isEqualTo(LATER);
    }

    @Test
    @DisplayName("Should return to active status when reactivated")
    void testReactivate() {
        JobRecord record = scheduledJob();
        record.apply(JobPatch.newBuilder().withActive(false).build(), LATER);

        record.apply(JobPatch.newBuilder().withActive(true).build(), LATER.plusSeconds(1));

        assertThat(record.getStatus()).isEqualTo(Job.Status.ACTIVE);
        assertThat(record.isSchedulable()).isTrue();
    }

    @Test
    @DisplayName("Should become on-demand when the schedule is cleared")
    void testClearSchedule() {
        JobRecord record = scheduledJob();

        record.apply(JobPatch.newBuilder().clearSchedule().build(), LATER);

        assertThat(record.getScheduleExpr()).isNull();
        assertThat(record.isSchedulable()).isFalse();
        assertThat(record.getNextRun()).isNull();
        assertThat(record.isActive()).isTrue();
    }

    @Test
    @DisplayName("Should only change patched fields")
    void testPartialPatch() {
        JobRecord record = scheduledJob();
        Instant nextRun = record.getNextRun();

        record.apply(JobPatch.newBuilder().withName("renamed").withConfig(JobConfig.of("retentionDays", 7)).build(),
                LATER);

        assertThat(record.getName()).isEqualTo("renamed");
        assertThat(record.getConfig().getInt("retentionDays", 0)).isEqualTo(7);
        assertThat(record.getScheduleExpr()).isEqualTo("0 3 * * *");
        assertThat(record.getNextRun()).isEqualTo(nextRun);
        assertThat(record.getCreatedAt()).isEqualTo(CREATED);
    }

    @Test
    @DisplayName("Should report which patches affect the timer")
    void testAffectsSchedule() {
        assertThat(JobPatch.newBuilder().withName("x").build().affectsSchedule()).isFalse();
        assertThat(JobPatch.newBuilder().withActive(true).build().affectsSchedule()).isTrue();
        assertThat(JobPatch.newBuilder().withSchedule("@daily").build().affectsSchedule()).isTrue();
        assertThat(JobPatch.newBuilder().build().isEmpty()).isTrue();
    }
}
