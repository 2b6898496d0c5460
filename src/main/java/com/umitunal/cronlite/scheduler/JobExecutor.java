package com.umitunal.cronlite.scheduler;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.CronLiteException;
import com.umitunal.cronlite.core.ExecutionLogEntry;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.UnregisteredHandlerException;
import com.umitunal.cronlite.task.TaskHandler;
import com.umitunal.cronlite.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one job's handler and records the outcome.
 *
 * <p>At most one execution per job id is in progress at any time; a second
 * request is rejected without invoking the handler. Handler failures, timeouts
 * and bookkeeping errors are all contained here and never reach the caller.
 */
public class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobStore store;
    private final TaskRegistry registry;
    private final SchedulerConfig config;
    private final Clock clock;
    private final ExecutorService handlerPool;
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);

    public JobExecutor(JobStore store, TaskRegistry registry, SchedulerConfig config, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
        this.handlerPool = Executors.newCachedThreadPool(ExecutorTimerService.namedThreads("cronlite-task"));
    }

    /**
     * Execute the job now on the calling thread.
     */
    public ExecutionOutcome run(Job job) {
        return start(job).await();
    }

    /**
     * Claim the job's single-flight slot, append its started entry and hand the
     * handler to the task pool without waiting for it.
     *
     * <p>The slot is held until both the handler thread and {@link Execution#await()}
     * are done, so a handler that outlives its timeout still blocks the next run.
     */
    Execution start(Job job) {
        if (!running.add(job.getId())) {
            rejectedCount.incrementAndGet();
            log.warn("Job {} ({}) is already running, skipping this execution", job.getName(), job.getId());
            return new Execution(job, ExecutionOutcome.alreadyRunning(job.getId(), clock.instant()));
        }

        Execution execution = new Execution(job, null);
        append(ExecutionLogEntry.started(job.getId(), execution.runId,
                "Job " + job.getName() + " started", execution.startedAt));
        try {
            TaskHandler handler = registry.handlerFor(job.getType());
            execution.future = handlerPool.submit(() -> execution.invoke(handler));
        } catch (UnregisteredHandlerException e) {
            execution.startFailure = e;
            execution.abandonHandler();
        } catch (RejectedExecutionException e) {
            execution.startFailure = new ExecutionException("task pool is shut down", e);
            execution.abandonHandler();
        }
        return execution;
    }

    public boolean isRunning(String jobId) {
        return running.contains(jobId);
    }

    private ExecutionOutcome finish(Execution execution) {
        Job job = execution.job;
        String runId = execution.runId;
        Instant startedAt = execution.startedAt;

        ExecutionOutcome outcome;
        try {
            TaskHandler.TaskResult result = execution.waitForResult(timeoutFor(job));
            if (result == null) {
                outcome = failure(job, runId, ExecutionOutcome.FailureKind.HANDLER_ERROR,
                        "handler returned no result", startedAt);
            } else if (result.isSuccess()) {
                String message = result.getMessage() != null
                        ? result.getMessage()
                        : "Job " + job.getName() + " completed successfully";
                outcome = ExecutionOutcome.completed(job.getId(), runId, message, startedAt, clock.instant());
            } else {
                outcome = failure(job, runId, ExecutionOutcome.FailureKind.HANDLER_ERROR,
                        result.getMessage(), startedAt);
            }
        } catch (UnregisteredHandlerException e) {
            outcome = failure(job, runId, ExecutionOutcome.FailureKind.UNREGISTERED_HANDLER, e.getMessage(), startedAt);
        } catch (TimeoutException e) {
            outcome = failure(job, runId, ExecutionOutcome.FailureKind.TIMED_OUT,
                    "timed out after " + timeoutFor(job), startedAt);
        } catch (ExecutionException e) {
            outcome = failure(job, runId, ExecutionOutcome.FailureKind.HANDLER_ERROR, describe(e.getCause()), startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = failure(job, runId, ExecutionOutcome.FailureKind.HANDLER_ERROR, "interrupted", startedAt);
        }

        if (outcome.isSuccess()) {
            completedCount.incrementAndGet();
            append(ExecutionLogEntry.completed(job.getId(), runId, outcome.getMessage(),
                    startedAt, outcome.getCompletedAt()));
            record(job, successStatus(job), startedAt);
            log.info("Job {} ({}) completed successfully", job.getName(), job.getId());
        } else {
            failedCount.incrementAndGet();
            append(ExecutionLogEntry.failed(job.getId(), runId, outcome.getMessage(),
                    startedAt, outcome.getCompletedAt()));
            record(job, Job.Status.FAILED, startedAt);
            log.error("Job {} ({}) failed [{}]: {}", job.getName(), job.getId(),
                    outcome.getFailureKind(), outcome.getMessage());
        }
        return outcome;
    }

    private ExecutionOutcome failure(Job job, String runId, ExecutionOutcome.FailureKind kind,
                                     String reason, Instant startedAt) {
        return ExecutionOutcome.failed(job.getId(), runId, kind,
                "Job " + job.getName() + " failed: " + reason, startedAt, clock.instant());
    }

    private Duration timeoutFor(Job job) {
        return config.getTaskTimeout(job.getType());
    }

    private static Job.Status successStatus(Job job) {
        if (job.isSchedulable()) {
            return Job.Status.ACTIVE;
        }
        return job.getScheduleExpr() == null ? Job.Status.COMPLETED : Job.Status.PAUSED;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private void append(ExecutionLogEntry entry) {
        try {
            store.appendLog(entry);
        } catch (CronLiteException e) {
            log.error("Failed to append {} log entry for job {}", entry.getStatus(), entry.getJobId(), e);
        }
    }

    private void record(Job job, Job.Status status, Instant attemptTime) {
        try {
            store.recordRun(job.getId(), status, attemptTime);
        } catch (JobNotFoundException e) {
            log.warn("Job {} was deleted while running, status not recorded", job.getId());
        } catch (CronLiteException e) {
            log.error("Failed to record run of job {}", job.getId(), e);
        }
    }

    public long getCompletedCount() { return completedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public long getRejectedCount() { return rejectedCount.get(); }

    @Override
    public void close() {
        handlerPool.shutdownNow();
    }

    /**
     * One started (or rejected) run. The single-flight slot has two holders:
     * the handler thread and the thread that awaits the outcome.
     */
    final class Execution {
        private final Job job;
        private final ExecutionOutcome rejected;
        private final String runId;
        private final Instant startedAt;
        private final AtomicBoolean entered = new AtomicBoolean(false);
        private final AtomicInteger holders = new AtomicInteger(2);
        private volatile Future<TaskHandler.TaskResult> future;
        private volatile Exception startFailure;

        private Execution(Job job, ExecutionOutcome rejected) {
            this.job = job;
            this.rejected = rejected;
            this.runId = rejected == null ? UUID.randomUUID().toString() : null;
            this.startedAt = rejected == null ? clock.instant() : rejected.getStartedAt();
        }

        /**
         * Wait for the handler and record the terminal entry.
         */
        ExecutionOutcome await() {
            if (rejected != null) {
                return rejected;
            }
            try {
                return finish(this);
            } finally {
                release();
            }
        }

        private TaskHandler.TaskResult invoke(TaskHandler handler) throws Exception {
            if (!entered.compareAndSet(false, true)) {
                // Abandoned before the pool got to it
                return null;
            }
            try {
                return handler.execute(job.getConfig());
            } finally {
                release();
            }
        }

        private TaskHandler.TaskResult waitForResult(Duration timeout)
                throws TimeoutException, ExecutionException, InterruptedException {
            Exception failure = startFailure;
            if (failure instanceof UnregisteredHandlerException) {
                throw (UnregisteredHandlerException) failure;
            }
            if (failure instanceof ExecutionException) {
                throw (ExecutionException) failure;
            }
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException | InterruptedException e) {
                future.cancel(true);
                abandonHandler();
                throw e;
            }
        }

        private void abandonHandler() {
            if (entered.compareAndSet(false, true)) {
                release();
            }
        }

        private void release() {
            if (holders.decrementAndGet() == 0) {
                running.remove(job.getId());
            }
        }
    }
}
