package com.umitunal.cronlite.core;

/**
 * Criteria for listing jobs. Unset criteria match everything.
 */
public class JobFilter {
    private static final JobFilter ALL = new JobFilter(null, null, null, null, false);

    private final String ownerId;
    private final JobType type;
    private final Boolean active;
    private final Job.Status status;
    private final boolean scheduledOnly;

    private JobFilter(String ownerId, JobType type, Boolean active, Job.Status status, boolean scheduledOnly) {
        this.ownerId = ownerId;
        this.type = type;
        this.active = active;
        this.status = status;
        this.scheduledOnly = scheduledOnly;
    }

    public static JobFilter all() {
        return ALL;
    }

    public static JobFilter byOwner(String ownerId) {
        return new JobFilter(ownerId, null, null, null, false);
    }

    /**
     * Jobs that should hold a timer: active and carrying a schedule.
     */
    public static JobFilter schedulable() {
        return new JobFilter(null, null, true, null, true);
    }

    public JobFilter withType(JobType type) {
        return new JobFilter(ownerId, type, active, status, scheduledOnly);
    }

    public JobFilter withActive(boolean active) {
        return new JobFilter(ownerId, type, active, status, scheduledOnly);
    }

    public JobFilter withStatus(Job.Status status) {
        return new JobFilter(ownerId, type, active, status, scheduledOnly);
    }

    public boolean matches(Job job) {
        if (ownerId != null && !ownerId.equals(job.getOwnerId())) return false;
        if (type != null && type != job.getType()) return false;
        if (active != null && active != job.isActive()) return false;
        if (status != null && status != job.getStatus()) return false;
        return !scheduledOnly || job.getScheduleExpr() != null;
    }
}
