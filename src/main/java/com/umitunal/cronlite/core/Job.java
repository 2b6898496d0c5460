package com.umitunal.cronlite.core;

import java.time.Instant;

/**
 * A named, typed unit of work that may recur on a cron-style schedule.
 */
public interface Job {

    /**
     * Gets the unique identifier assigned by the store.
     */
    String getId();

    /**
     * Gets the identifier of the principal owning this job.
     */
    String getOwnerId();

    String getName();

    /**
     * Gets the task type, which selects the handler that runs this job.
     */
    JobType getType();

    /**
     * Gets the recurrence expression, or null for jobs that only run on demand.
     */
    String getScheduleExpr();

    /**
     * Gets the handler-specific payload.
     */
    JobConfig getConfig();

    /**
     * Inactive jobs are never armed, even when they carry a schedule.
     */
    boolean isActive();

    /**
     * Gets the state left behind by the most recent execution.
     */
    Status getStatus();

    /**
     * Gets the time of the most recent execution attempt, or null.
     */
    Instant getLastRun();

    /**
     * Gets the time the armed timer will fire, or null when unarmed.
     */
    Instant getNextRun();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    /**
     * Checks whether this job should hold a timer.
     */
    default boolean isSchedulable() {
        return isActive() && getScheduleExpr() != null;
    }

    /**
     * Last known run state of a job.
     */
    enum Status {
        ACTIVE,      // Armed or last run succeeded
        PAUSED,      // Deactivated by an update
        COMPLETED,   // On-demand job finished successfully
        FAILED       // Last run or last arm attempt failed
    }
}
