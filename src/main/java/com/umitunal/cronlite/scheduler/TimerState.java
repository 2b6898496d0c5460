package com.umitunal.cronlite.scheduler;

/**
 * Scheduling state of one job.
 */
public enum TimerState {
    UNARMED,     // No timer: inactive, unscheduled, deleted or arm failed
    ARMED,       // Timer pending
    FIRING       // Execution in progress, rearm follows
}
