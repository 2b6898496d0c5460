package com.umitunal.cronlite.scheduler;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.CronLiteException;
import com.umitunal.cronlite.core.InvalidExpressionException;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobChange;
import com.umitunal.cronlite.core.JobFilter;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.JobStoreListener;
import com.umitunal.cronlite.core.NoUpcomingOccurrenceException;
import com.umitunal.cronlite.schedule.CronExpression;
import com.umitunal.cronlite.task.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps exactly one pending timer for every active job that has a schedule.
 *
 * <p>The scheduler listens to the job store: creating, updating or deleting a
 * job re-arms or disarms its timer. Each job id is guarded by the compute
 * section of a {@link ConcurrentHashMap}, so arming, firing and disarming the
 * same job never interleave, while different jobs proceed independently.
 *
 * <p>Usage example:
 * <pre>{@code
 * try (JobScheduler scheduler = JobScheduler.create(store, registry, SchedulerConfig.defaults())) {
 *     scheduler.start();
 *     store.create(NewJob.newBuilder("owner-1", "nightly cleanup", JobType.CLEANUP)
 *             .withSchedule("0 3 * * *")
 *             .build());
 * }
 * }</pre>
 */
public class JobScheduler implements JobStoreListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final JobExecutor executor;
    private final TimerService timers;
    private final Executor workers;
    private final Clock clock;
    private final ZoneId zone;
    private final SchedulerConfig config;
    private final List<AutoCloseable> owned;
    private final ConcurrentHashMap<String, ArmedJob> armed = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private JobScheduler(Builder builder) {
        this.store = builder.store;
        this.executor = builder.executor;
        this.timers = builder.timers;
        this.workers = builder.workers;
        this.clock = builder.clock;
        this.zone = builder.config.getZone();
        this.config = builder.config;
        this.owned = List.copyOf(builder.owned);
    }

    /**
     * Create a scheduler that owns its timer, worker and executor threads.
     */
    public static JobScheduler create(JobStore store, TaskRegistry registry, SchedulerConfig config) {
        Clock clock = Clock.system(config.getZone());
        JobExecutor executor = new JobExecutor(store, registry, config, clock);
        ExecutorTimerService timers = new ExecutorTimerService(config.getTimerThreads(), clock);
        ExecutorService workers = Executors.newFixedThreadPool(config.getWorkerThreads(),
                ExecutorTimerService.namedThreads("cronlite-worker"));
        return newBuilder(store, executor)
                .withTimerService(timers)
                .withWorkers(workers)
                .withClock(clock)
                .withConfig(config)
                .owning(executor)
                .owning(timers)
                .owning(workers::shutdown)
                .build();
    }

    public static Builder newBuilder(JobStore store, JobExecutor executor) {
        return new Builder(store, executor);
    }

    /**
     * Subscribe to store changes and arm every schedulable job.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Scheduler is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        store.addListener(this);

        List<Job> jobs = store.list(JobFilter.schedulable());
        for (Job job : jobs) {
            reschedule(job);
        }
        log.info("Scheduler started, {} of {} schedulable jobs armed", armed.size(), jobs.size());
    }

    /**
     * Bring the job's timer in line with its stored record: cancel any pending
     * timer and arm a new one when the job is active and has a schedule.
     *
     * <p>The record is read again inside the job's critical section, so
     * notifications that arrive out of commit order cannot leave a stale timer
     * state behind.
     */
    public void reschedule(Job job) {
        reschedule(job.getId());
    }

    public void reschedule(String jobId) {
        if (closed.get()) {
            return;
        }
        armed.compute(jobId, (id, current) -> {
            Optional<Job> stored = store.find(id);
            if (current != null) {
                current.cancel();
            }
            return stored.isPresent() ? arm(stored.get()) : null;
        });
    }

    /**
     * Cancel the job's pending timer, if any.
     */
    public void disarm(String jobId) {
        ArmedJob removed = armed.remove(jobId);
        if (removed != null) {
            removed.cancel();
            log.debug("Job {} disarmed", jobId);
        }
    }

    /**
     * Run the job immediately on a worker, outside its schedule. The same
     * single-flight rule as timed runs applies.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public CompletableFuture<ExecutionOutcome> runNow(String jobId) {
        store.get(jobId);
        return CompletableFuture.supplyAsync(() -> {
            JobExecutor.Execution execution = startGuarded(jobId, null);
            if (execution == null) {
                throw new JobNotFoundException(jobId);
            }
            return execution.await();
        }, workers);
    }

    public boolean isArmed(String jobId) {
        return armed.containsKey(jobId);
    }

    public Set<String> armedJobIds() {
        return new TreeSet<>(armed.keySet());
    }

    public TimerState stateOf(String jobId) {
        ArmedJob entry = armed.get(jobId);
        return entry == null ? TimerState.UNARMED : entry.state;
    }

    public Optional<Instant> nextFireTime(String jobId) {
        ArmedJob entry = armed.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.fireAt);
    }

    public JobExecutor getExecutor() {
        return executor;
    }

    @Override
    public void onJobSaved(JobChange change) {
        if (change.isScheduleAffected()) {
            reschedule(change.getCurrent());
        }
    }

    @Override
    public void onJobDeleting(String jobId) {
        disarm(jobId);
    }

    @Override
    public void onJobDeleted(String jobId) {
        // A reschedule may have re-armed the job between the two callbacks
        disarm(jobId);
    }

    // Runs inside the compute section of the job id
    private ArmedJob arm(Job job) {
        if (!job.isSchedulable()) {
            if (job.getNextRun() != null) {
                persistNextRun(job.getId(), null);
            }
            return null;
        }

        CronExpression cron;
        Instant fireAt;
        try {
            cron = CronExpression.parse(job.getScheduleExpr(), zone);
            fireAt = cron.nextFireTime(clock.instant());
        } catch (InvalidExpressionException | NoUpcomingOccurrenceException e) {
            log.error("Cannot arm job {} ({}): {}", job.getName(), job.getId(), e.getMessage());
            markUnschedulable(job.getId());
            return null;
        }
        return armAt(job.getId(), cron, fireAt);
    }

    private ArmedJob armAt(String jobId, CronExpression cron, Instant fireAt) {
        ArmedJob entry = new ArmedJob(jobId, cron, fireAt);
        entry.timer = timers.schedule(() -> fire(entry), fireAt);
        persistNextRun(jobId, fireAt);
        log.debug("Job {} armed for {}", jobId, fireAt);
        return entry;
    }

    private void fire(ArmedJob entry) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        armed.computeIfPresent(entry.jobId, (id, current) -> {
            if (current == entry && current.state == TimerState.ARMED) {
                current.state = TimerState.FIRING;
                claimed.set(true);
            }
            return current;
        });
        if (!claimed.get()) {
            return;
        }

        try {
            workers.execute(() -> runFired(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected job {}, scheduler is shutting down", entry.jobId);
        }
    }

    private void runFired(ArmedJob entry) {
        try {
            JobExecutor.Execution execution = startGuarded(entry.jobId, entry);
            if (execution == null) {
                log.debug("Job {} was disarmed or deleted before it started, skipping fire", entry.jobId);
                return;
            }
            execution.await();
        } catch (CronLiteException e) {
            log.error("Unexpected error firing job {}", entry.jobId, e);
        } finally {
            rearmAfterFire(entry);
        }
    }

    /**
     * Start a run inside the job's critical section, so a concurrent disarm
     * either happens first and prevents the start, or waits until the started
     * entry is written. With a non-null entry the run only starts while that
     * entry is still the job's timer.
     *
     * @return the started or rejected execution, or null when nothing was started
     */
    private JobExecutor.Execution startGuarded(String jobId, ArmedJob expected) {
        AtomicReference<JobExecutor.Execution> started = new AtomicReference<>();
        armed.compute(jobId, (id, current) -> {
            if (expected != null && current != expected) {
                return current;
            }
            Optional<Job> job = store.find(id);
            if (job.isEmpty()) {
                if (current != null) {
                    current.cancel();
                }
                return null;
            }
            started.set(executor.start(job.get()));
            return current;
        });
        return started.get();
    }

    private void rearmAfterFire(ArmedJob entry) {
        if (closed.get()) {
            return;
        }
        armed.computeIfPresent(entry.jobId, (id, current) -> {
            if (current != entry) {
                // Replaced by a reschedule while firing
                return current;
            }
            Instant now = clock.instant();
            Instant base = entry.fireAt.isAfter(now) ? entry.fireAt : now;
            try {
                return armAt(id, entry.cron, entry.cron.nextFireTime(base));
            } catch (NoUpcomingOccurrenceException e) {
                log.error("Job {} has no further occurrences: {}", id, e.getMessage());
                markUnschedulable(id);
                return null;
            }
        });
    }

    private void markUnschedulable(String jobId) {
        try {
            store.recordStatus(jobId, Job.Status.FAILED);
            store.recordNextRun(jobId, null);
        } catch (JobNotFoundException e) {
            log.debug("Job {} is gone, nothing to mark", jobId);
        } catch (CronLiteException e) {
            log.error("Failed to mark job {} as unschedulable", jobId, e);
        }
    }

    private void persistNextRun(String jobId, Instant nextRun) {
        try {
            store.recordNextRun(jobId, nextRun);
        } catch (JobNotFoundException e) {
            log.debug("Job {} is gone, next run not recorded", jobId);
        } catch (CronLiteException e) {
            log.error("Failed to record next run of job {}", jobId, e);
        }
    }

    /**
     * Cancel all timers and stop the threads this scheduler owns. Executions
     * already running get the configured shutdown timeout to finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        store.removeListener(this);
        for (String jobId : armed.keySet()) {
            disarm(jobId);
        }

        if (workers instanceof ExecutorService) {
            ExecutorService pool = (ExecutorService) workers;
            pool.shutdown();
            try {
                if (!pool.awaitTermination(config.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Running jobs did not finish within {}", config.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        for (AutoCloseable resource : owned) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Error releasing scheduler resource", e);
            }
        }
        log.info("Scheduler stopped");
    }

    private static final class ArmedJob {
        private final String jobId;
        private final CronExpression cron;
        private final Instant fireAt;
        private volatile TimerState state = TimerState.ARMED;
        private volatile TimerService.Timer timer;

        private ArmedJob(String jobId, CronExpression cron, Instant fireAt) {
            this.jobId = jobId;
            this.cron = cron;
            this.fireAt = fireAt;
        }

        private void cancel() {
            TimerService.Timer handle = timer;
            if (handle != null) {
                handle.cancel();
            }
        }
    }

    public static class Builder {
        private final JobStore store;
        private final JobExecutor executor;
        private final List<AutoCloseable> owned = new ArrayList<>();
        private TimerService timers;
        private Executor workers;
        private Clock clock = Clock.systemUTC();
        private SchedulerConfig config = SchedulerConfig.defaults();

        private Builder(JobStore store, JobExecutor executor) {
            if (store == null || executor == null) {
                throw new IllegalArgumentException("Store and executor are required");
            }
            this.store = store;
            this.executor = executor;
        }

        public Builder withTimerService(TimerService timers) {
            this.timers = timers;
            return this;
        }

        public Builder withWorkers(Executor workers) {
            this.workers = workers;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Close the given resource together with the scheduler.
         */
        public Builder owning(AutoCloseable resource) {
            owned.add(resource);
            return this;
        }

        public JobScheduler build() {
            if (timers == null) {
                ExecutorTimerService service = new ExecutorTimerService(config.getTimerThreads(), clock);
                timers = service;
                owned.add(service);
            }
            if (workers == null) {
                ExecutorService pool = Executors.newFixedThreadPool(config.getWorkerThreads(),
                        ExecutorTimerService.namedThreads("cronlite-worker"));
                workers = pool;
                owned.add(pool::shutdownNow);
            }
            return new JobScheduler(this);
        }
    }
}
