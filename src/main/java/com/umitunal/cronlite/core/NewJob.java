package com.umitunal.cronlite.core;

/**
 * Creation request for a job. The store assigns id, status and timestamps.
 */
public class NewJob {
    private final String ownerId;
    private final String name;
    private final JobType type;
    private final String scheduleExpr;
    private final JobConfig config;
    private final boolean active;

    private NewJob(Builder builder) {
        this.ownerId = builder.ownerId;
        this.name = builder.name;
        this.type = builder.type;
        this.scheduleExpr = builder.scheduleExpr;
        this.config = builder.config;
        this.active = builder.active;
    }

    public String getOwnerId() { return ownerId; }
    public String getName() { return name; }
    public JobType getType() { return type; }
    public String getScheduleExpr() { return scheduleExpr; }
    public JobConfig getConfig() { return config; }
    public boolean isActive() { return active; }

    public static Builder newBuilder(String ownerId, String name, JobType type) {
        return new Builder(ownerId, name, type);
    }

    /**
     * Start a builder from a type tag as it arrives from callers.
     *
     * @throws UnknownJobTypeException if the tag names no known type
     */
    public static Builder newBuilder(String ownerId, String name, String typeTag) {
        return new Builder(ownerId, name, JobType.fromTag(typeTag));
    }

    public static class Builder {
        private final String ownerId;
        private final String name;
        private final JobType type;
        private String scheduleExpr;
        private JobConfig config = JobConfig.empty();
        private boolean active = true;

        private Builder(String ownerId, String name, JobType type) {
            this.ownerId = ownerId;
            this.name = name;
            this.type = type;
        }

        /**
         * Set the recurrence expression. Null means on-demand only.
         */
        public Builder withSchedule(String scheduleExpr) {
            this.scheduleExpr = scheduleExpr;
            return this;
        }

        public Builder withConfig(JobConfig config) {
            this.config = config != null ? config : JobConfig.empty();
            return this;
        }

        /**
         * Default: true
         */
        public Builder withActive(boolean active) {
            this.active = active;
            return this;
        }

        public NewJob build() {
            return new NewJob(this);
        }
    }
}
