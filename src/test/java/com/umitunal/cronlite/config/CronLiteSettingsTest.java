package com.umitunal.cronlite.config;

import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class CronLiteSettingsTest {

    private static Properties properties(String... pairs) {
        Properties properties = new Properties();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.setProperty(pairs[i], pairs[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Should load the bundled defaults from the classpath")
    void testClasspathDefaults() {
        CronLiteSettings settings = CronLiteSettings.load();

        assertThat(settings.getCodec()).isEqualTo("json");
        assertThat(settings.toSchedulerConfig().getTaskTimeout(JobType.WEBHOOK)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("Should fall back to built-in defaults when nothing is set")
    void testBuiltInDefaults() {
        // Given
        CronLiteSettings settings = CronLiteSettings.of(new Properties(), Map.of());

        // When
        SchedulerConfig scheduler = settings.toSchedulerConfig();
        StorageConfig storage = settings.toStorageConfig();

        // Then
        assertThat(settings.getDataDirectory()).isEqualTo("data/cronlite");
        assertThat(settings.getWebhookSecret()).isNull();
        assertThat(scheduler.getZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(scheduler.getWorkerThreads()).isEqualTo(4);
        assertThat(scheduler.getDefaultTaskTimeout()).isEqualTo(Duration.ofMinutes(30));
        assertThat(storage.isDurableWrites()).isTrue();
    }

    @Test
    @DisplayName("Should read properties and per-type timeouts")
    void testProperties() {
        // Given
        CronLiteSettings settings = CronLiteSettings.of(properties(
                "cronlite.data-dir", "/var/lib/cronlite",
                "cronlite.durable-writes", "false",
                "cronlite.zone", "Europe/Istanbul",
                "cronlite.worker-threads", "8",
                "cronlite.task-timeout-seconds", "600",
                "cronlite.task-timeout-seconds.backup", "7200"), Map.of());

        // When
        SchedulerConfig scheduler = settings.toSchedulerConfig();

        // Then
        assertThat(settings.toStorageConfig().getDataDirectory()).isEqualTo("/var/lib/cronlite");
        assertThat(settings.toStorageConfig().isDurableWrites()).isFalse();
        assertThat(scheduler.getZone()).isEqualTo(ZoneId.of("Europe/Istanbul"));
        assertThat(scheduler.getWorkerThreads()).isEqualTo(8);
        assertThat(scheduler.getTaskTimeout(JobType.BACKUP)).isEqualTo(Duration.ofHours(2));
        assertThat(scheduler.getTaskTimeout(JobType.CLEANUP)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("Should let environment variables override properties")
    void testEnvironmentOverride() {
        CronLiteSettings settings = CronLiteSettings.of(
                properties("cronlite.worker-threads", "8", "cronlite.webhook.secret", "from-file"),
                Map.of("CRONLITE_WORKER_THREADS", "2", "CRONLITE_WEBHOOK_SECRET", "from-env"));

        assertThat(settings.toSchedulerConfig().getWorkerThreads()).isEqualTo(2);
        assertThat(settings.getWebhookSecret()).isEqualTo("from-env");
    }

    @Test
    @DisplayName("Should map keys to environment variable names")
    void testEnvironmentName() {
        assertThat(CronLiteSettings.environmentName("cronlite.task-timeout-seconds.virus_scan"))
                .isEqualTo("CRONLITE_TASK_TIMEOUT_SECONDS_VIRUS_SCAN");
    }

    @Test
    @DisplayName("Should reject malformed numbers")
    void testMalformedNumber() {
        CronLiteSettings settings = CronLiteSettings.of(properties("cronlite.worker-threads", "many"), Map.of());

        assertThatThrownBy(settings::toSchedulerConfig)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cronlite.worker-threads");
    }
}
