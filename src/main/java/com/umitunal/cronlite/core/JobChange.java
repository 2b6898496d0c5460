package com.umitunal.cronlite.core;

/**
 * A committed create or update, as delivered to {@link JobStoreListener}s.
 */
public class JobChange {
    private final Job previous;
    private final Job current;
    private final boolean scheduleAffected;

    private JobChange(Job previous, Job current, boolean scheduleAffected) {
        this.previous = previous;
        this.current = current;
        this.scheduleAffected = scheduleAffected;
    }

    public static JobChange created(Job job) {
        return new JobChange(null, job, true);
    }

    public static JobChange updated(Job previous, Job current, JobPatch patch) {
        return new JobChange(previous, current, patch.affectsSchedule());
    }

    /**
     * Gets the record before the change, or null for a creation.
     */
    public Job getPrevious() { return previous; }

    public Job getCurrent() { return current; }

    public boolean isCreation() { return previous == null; }

    /**
     * True when the change touched the schedule or the active flag.
     */
    public boolean isScheduleAffected() { return scheduleAffected; }
}
