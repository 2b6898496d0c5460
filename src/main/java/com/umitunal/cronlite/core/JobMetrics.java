package com.umitunal.cronlite.core;

/**
 * Counts of stored jobs for operator dashboards.
 */
public class JobMetrics {
    private final long totalJobs;
    private final long activeJobs;
    private final long scheduledJobs;
    private final long pausedJobs;
    private final long completedJobs;
    private final long failedJobs;
    private final long logEntries;

    public JobMetrics(long totalJobs, long activeJobs, long scheduledJobs, long pausedJobs,
                      long completedJobs, long failedJobs, long logEntries) {
        this.totalJobs = totalJobs;
        this.activeJobs = activeJobs;
        this.scheduledJobs = scheduledJobs;
        this.pausedJobs = pausedJobs;
        this.completedJobs = completedJobs;
        this.failedJobs = failedJobs;
        this.logEntries = logEntries;
    }

    public long getTotalJobs() { return totalJobs; }
    public long getActiveJobs() { return activeJobs; }
    public long getScheduledJobs() { return scheduledJobs; }
    public long getPausedJobs() { return pausedJobs; }
    public long getCompletedJobs() { return completedJobs; }
    public long getFailedJobs() { return failedJobs; }
    public long getLogEntries() { return logEntries; }

    @Override
    public String toString() {
        return String.format(
            "JobMetrics{total=%d, active=%d, scheduled=%d, paused=%d, completed=%d, failed=%d, logs=%d}",
            totalJobs, activeJobs, scheduledJobs, pausedJobs, completedJobs, failedJobs, logEntries
        );
    }
}
