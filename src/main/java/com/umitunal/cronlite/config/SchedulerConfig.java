package com.umitunal.cronlite.config;

import com.umitunal.cronlite.core.JobType;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the scheduler and executor thread pools and task timeouts.
 */
public class SchedulerConfig {
    private final ZoneId zone;
    private final int timerThreads;
    private final int workerThreads;
    private final Duration defaultTaskTimeout;
    private final Map<JobType, Duration> taskTimeouts;
    private final Duration shutdownTimeout;

    private SchedulerConfig(Builder builder) {
        this.zone = builder.zone;
        this.timerThreads = builder.timerThreads;
        this.workerThreads = builder.workerThreads;
        this.defaultTaskTimeout = builder.defaultTaskTimeout;
        this.taskTimeouts = Collections.unmodifiableMap(new EnumMap<>(builder.taskTimeouts));
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public ZoneId getZone() { return zone; }
    public int getTimerThreads() { return timerThreads; }
    public int getWorkerThreads() { return workerThreads; }
    public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }

    /**
     * Timeout applied to handlers of the given type.
     */
    public Duration getTaskTimeout(JobType type) {
        return taskTimeouts.getOrDefault(type, defaultTaskTimeout);
    }

    public static SchedulerConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private ZoneId zone = ZoneOffset.UTC;
        private int timerThreads = 1;
        private int workerThreads = 4;
        private Duration defaultTaskTimeout = Duration.ofMinutes(30);
        private final Map<JobType, Duration> taskTimeouts = new EnumMap<>(JobType.class);
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        private Builder() {
        }

        /**
         * Zone in which schedule expressions are evaluated.
         * Default: UTC
         */
        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /**
         * Threads that only dispatch fired timers.
         * Default: 1
         */
        public Builder withTimerThreads(int count) {
            this.timerThreads = requirePositive(count);
            return this;
        }

        /**
         * Maximum number of jobs executing at once.
         * Default: 4
         */
        public Builder withWorkerThreads(int count) {
            this.workerThreads = requirePositive(count);
            return this;
        }

        /**
         * Default: 30 minutes
         */
        public Builder withDefaultTaskTimeout(Duration timeout) {
            this.defaultTaskTimeout = requirePositive(timeout);
            return this;
        }

        public Builder withTaskTimeout(JobType type, Duration timeout) {
            this.taskTimeouts.put(type, requirePositive(timeout));
            return this;
        }

        /**
         * How long close() waits for running executions.
         * Default: 5 seconds
         */
        public Builder withShutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }

        private static int requirePositive(int count) {
            if (count < 1) {
                throw new IllegalArgumentException("count must be >= 1: " + count);
            }
            return count;
        }

        private static Duration requirePositive(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            return timeout;
        }
    }
}
