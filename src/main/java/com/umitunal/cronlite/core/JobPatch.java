package com.umitunal.cronlite.core;

/**
 * Partial update of a job. Only name, schedule, config and the active flag are mutable.
 */
public class JobPatch {
    private final String name;
    private final boolean scheduleSet;
    private final String scheduleExpr;
    private final JobConfig config;
    private final Boolean active;

    private JobPatch(Builder builder) {
        this.name = builder.name;
        this.scheduleSet = builder.scheduleSet;
        this.scheduleExpr = builder.scheduleExpr;
        this.config = builder.config;
        this.active = builder.active;
    }

    public boolean hasName() { return name != null; }
    public String getName() { return name; }

    public boolean hasSchedule() { return scheduleSet; }

    /**
     * The new expression; null when the patch clears the schedule.
     */
    public String getScheduleExpr() { return scheduleExpr; }

    public boolean hasConfig() { return config != null; }
    public JobConfig getConfig() { return config; }

    public boolean hasActive() { return active != null; }
    public Boolean getActive() { return active; }

    public boolean isEmpty() {
        return !hasName() && !hasSchedule() && !hasConfig() && !hasActive();
    }

    /**
     * True when applying this patch requires the job's timer to be rebuilt.
     */
    public boolean affectsSchedule() {
        return hasSchedule() || hasActive();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("JobPatch{name=%s, schedule=%s, config=%s, active=%s}",
                name, scheduleSet ? scheduleExpr : "<unchanged>", config, active);
    }

    public static class Builder {
        private String name;
        private boolean scheduleSet;
        private String scheduleExpr;
        private JobConfig config;
        private Boolean active;

        private Builder() {
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withSchedule(String scheduleExpr) {
            this.scheduleSet = true;
            this.scheduleExpr = scheduleExpr;
            return this;
        }

        /**
         * Turn the job into an on-demand job.
         */
        public Builder clearSchedule() {
            return withSchedule(null);
        }

        public Builder withConfig(JobConfig config) {
            this.config = config;
            return this;
        }

        public Builder withActive(boolean active) {
            this.active = active;
            return this;
        }

        public JobPatch build() {
            return new JobPatch(this);
        }
    }
}
