package com.umitunal.cronlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one step of a job run. Every run appends a {@code STARTED}
 * entry and then exactly one terminal entry sharing the same run id.
 */
public final class ExecutionLogEntry {
    private final long id;
    private final String jobId;
    private final String runId;
    private final Status status;
    private final String message;
    private final Instant startedAt;
    private final Instant completedAt;

    public ExecutionLogEntry(long id, String jobId, String runId, Status status, String message,
                             Instant startedAt, Instant completedAt) {
        this.id = id;
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.runId = Objects.requireNonNull(runId, "runId");
        this.status = Objects.requireNonNull(status, "status");
        this.message = message;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.completedAt = completedAt;
    }

    public static ExecutionLogEntry started(String jobId, String runId, String message, Instant startedAt) {
        return new ExecutionLogEntry(0, jobId, runId, Status.STARTED, message, startedAt, null);
    }

    public static ExecutionLogEntry completed(String jobId, String runId, String message,
                                              Instant startedAt, Instant completedAt) {
        return new ExecutionLogEntry(0, jobId, runId, Status.COMPLETED, message, startedAt, completedAt);
    }

    public static ExecutionLogEntry failed(String jobId, String runId, String message,
                                           Instant startedAt, Instant completedAt) {
        return new ExecutionLogEntry(0, jobId, runId, Status.FAILED, message, startedAt, completedAt);
    }

    /**
     * Copy carrying the sequence number assigned by the store.
     */
    public ExecutionLogEntry withId(long id) {
        return new ExecutionLogEntry(id, jobId, runId, status, message, startedAt, completedAt);
    }

    public long getId() { return id; }
    public String getJobId() { return jobId; }
    public String getRunId() { return runId; }
    public Status getStatus() { return status; }
    public String getMessage() { return message; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    public boolean isTerminal() {
        return status != Status.STARTED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionLogEntry)) return false;
        ExecutionLogEntry that = (ExecutionLogEntry) o;
        return id == that.id && jobId.equals(that.jobId) && runId.equals(that.runId)
                && status == that.status && Objects.equals(message, that.message)
                && startedAt.equals(that.startedAt) && Objects.equals(completedAt, that.completedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, jobId, runId, status, message, startedAt, completedAt);
    }

    @Override
    public String toString() {
        return String.format("ExecutionLogEntry{id=%d, job='%s', run='%s', status=%s, message='%s'}",
                id, jobId, runId, status, message);
    }

    public enum Status {
        STARTED,
        COMPLETED,
        FAILED
    }
}
