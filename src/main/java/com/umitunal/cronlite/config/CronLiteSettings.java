package com.umitunal.cronlite.config;

import com.umitunal.cronlite.core.JobType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Settings read from {@code cronlite.properties}, each overridable by an
 * environment variable: {@code cronlite.worker-threads} becomes
 * {@code CRONLITE_WORKER_THREADS}.
 */
public class CronLiteSettings {
    public static final String RESOURCE = "cronlite.properties";

    static final String DATA_DIR = "cronlite.data-dir";
    static final String DURABLE_WRITES = "cronlite.durable-writes";
    static final String CODEC = "cronlite.codec";
    static final String ZONE = "cronlite.zone";
    static final String TIMER_THREADS = "cronlite.timer-threads";
    static final String WORKER_THREADS = "cronlite.worker-threads";
    static final String TASK_TIMEOUT = "cronlite.task-timeout-seconds";
    static final String WEBHOOK_SECRET = "cronlite.webhook.secret";

    private final Properties properties;
    private final Map<String, String> environment;

    CronLiteSettings(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * Load the classpath defaults and apply the process environment.
     */
    public static CronLiteSettings load() {
        Properties properties = new Properties();
        try (InputStream in = CronLiteSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        return new CronLiteSettings(properties, System.getenv());
    }

    public static CronLiteSettings of(Properties properties, Map<String, String> environment) {
        return new CronLiteSettings(properties, environment);
    }

    public String getDataDirectory() {
        return get(DATA_DIR, "data/cronlite");
    }

    public String getCodec() {
        return get(CODEC, "json");
    }

    public String getWebhookSecret() {
        return get(WEBHOOK_SECRET, null);
    }

    public StorageConfig toStorageConfig() {
        return StorageConfig.newBuilder(getDataDirectory())
                .withDurableWrites(Boolean.parseBoolean(get(DURABLE_WRITES, "true")))
                .build();
    }

    public SchedulerConfig toSchedulerConfig() {
        SchedulerConfig.Builder builder = SchedulerConfig.newBuilder()
                .withZone(ZoneId.of(get(ZONE, "UTC")))
                .withTimerThreads(getInt(TIMER_THREADS, 1))
                .withWorkerThreads(getInt(WORKER_THREADS, 4))
                .withDefaultTaskTimeout(Duration.ofSeconds(getInt(TASK_TIMEOUT, 1800)));

        for (JobType type : JobType.values()) {
            String value = get(TASK_TIMEOUT + "." + type.getTag(), null);
            if (value != null) {
                builder.withTaskTimeout(type, Duration.ofSeconds(parseInt(TASK_TIMEOUT + "." + type.getTag(), value)));
            }
        }
        return builder.build();
    }

    String get(String key, String defaultValue) {
        String fromEnv = environment.get(environmentName(key));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String value = properties.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = get(key, null);
        return value != null ? parseInt(key, value) : defaultValue;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not a number: " + value, e);
        }
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
