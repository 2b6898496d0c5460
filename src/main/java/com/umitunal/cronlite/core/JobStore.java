package com.umitunal.cronlite.core;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of job definitions and their execution history.
 * The store is the single source of truth; it never runs handlers.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Persist a new job.
     *
     * @return the stored record with its assigned id
     * @throws UnknownJobTypeException if no handler is registered for the type
     * @throws InvalidExpressionException if the schedule cannot be parsed
     * @throws NoUpcomingOccurrenceException if the schedule never fires
     */
    Job create(NewJob job);

    /**
     * @throws JobNotFoundException if no job has the id
     */
    Job get(String jobId);

    Optional<Job> find(String jobId);

    /**
     * List jobs matching the filter, most recently created first.
     */
    List<Job> list(JobFilter filter);

    /**
     * Apply a patch to the mutable fields of a job.
     *
     * @throws JobNotFoundException if no job has the id
     * @throws IllegalArgumentException if the patch is empty or names the job blank
     */
    Job update(String jobId, JobPatch patch);

    /**
     * Remove a job. Listeners are told before the record disappears.
     *
     * @return false if the job did not exist
     */
    boolean delete(String jobId);

    /**
     * Append an execution log entry.
     *
     * @return the entry with its assigned sequence number
     */
    ExecutionLogEntry appendLog(ExecutionLogEntry entry);

    /**
     * Page through a job's execution history, newest first.
     */
    LogPage listLogs(String jobId, Page page);

    /**
     * Record the outcome of an execution attempt.
     *
     * @throws JobNotFoundException if the job was deleted meanwhile
     */
    void recordRun(String jobId, Job.Status status, Instant lastRun);

    /**
     * Record the next fire time of the job's timer; null clears it.
     *
     * @throws JobNotFoundException if the job was deleted meanwhile
     */
    void recordNextRun(String jobId, Instant nextRun);

    /**
     * @throws JobNotFoundException if the job was deleted meanwhile
     */
    void recordStatus(String jobId, Job.Status status);

    JobMetrics getMetrics();

    void addListener(JobStoreListener listener);

    void removeListener(JobStoreListener listener);

    @Override
    void close();
}
