package com.umitunal.cronlite.scheduler;

import java.time.Instant;

/**
 * Result of one execution request.
 */
public class ExecutionOutcome {
    private final String jobId;
    private final String runId;
    private final Status status;
    private final FailureKind failureKind;
    private final String message;
    private final Instant startedAt;
    private final Instant completedAt;

    private ExecutionOutcome(String jobId, String runId, Status status, FailureKind failureKind,
                             String message, Instant startedAt, Instant completedAt) {
        this.jobId = jobId;
        this.runId = runId;
        this.status = status;
        this.failureKind = failureKind;
        this.message = message;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    static ExecutionOutcome completed(String jobId, String runId, String message,
                                      Instant startedAt, Instant completedAt) {
        return new ExecutionOutcome(jobId, runId, Status.COMPLETED, null, message, startedAt, completedAt);
    }

    static ExecutionOutcome failed(String jobId, String runId, FailureKind kind, String message,
                                   Instant startedAt, Instant completedAt) {
        return new ExecutionOutcome(jobId, runId, Status.FAILED, kind, message, startedAt, completedAt);
    }

    static ExecutionOutcome alreadyRunning(String jobId, Instant now) {
        return new ExecutionOutcome(jobId, null, Status.REJECTED, FailureKind.ALREADY_RUNNING,
                "Job " + jobId + " is already running", now, now);
    }

    public String getJobId() { return jobId; }

    /**
     * Gets the run id shared by this run's log entries; null when rejected.
     */
    public String getRunId() { return runId; }

    public Status getStatus() { return status; }

    /**
     * Gets why the run failed or was rejected; null on success.
     */
    public FailureKind getFailureKind() { return failureKind; }

    public String getMessage() { return message; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    @Override
    public String toString() {
        return String.format("ExecutionOutcome{job='%s', status=%s, kind=%s, message='%s'}",
                jobId, status, failureKind, message);
    }

    public enum Status {
        COMPLETED,
        FAILED,
        REJECTED     // Not run at all
    }

    public enum FailureKind {
        UNREGISTERED_HANDLER,
        TIMED_OUT,
        HANDLER_ERROR,
        ALREADY_RUNNING
    }
}
