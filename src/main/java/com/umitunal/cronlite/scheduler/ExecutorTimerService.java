package com.umitunal.cronlite.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timers backed by a ScheduledThreadPoolExecutor.
 */
public class ExecutorTimerService implements TimerService {
    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;

    public ExecutorTimerService(int threads, Clock clock) {
        this.clock = clock;
        this.executor = new ScheduledThreadPoolExecutor(threads, namedThreads("cronlite-timer"));
        // Disarmed jobs must not linger in the work queue
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public Timer schedule(Runnable task, Instant fireAt) {
        long delay = Math.max(0, Duration.between(clock.instant(), fireAt).toMillis());
        ScheduledFuture<?> future = executor.schedule(task, delay, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
