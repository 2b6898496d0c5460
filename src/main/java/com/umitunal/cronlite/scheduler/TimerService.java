package com.umitunal.cronlite.scheduler;

import java.time.Instant;

/**
 * Source of one-shot timers. Callbacks must only dispatch work, never block.
 */
public interface TimerService extends AutoCloseable {

    /**
     * Run the task at (or as soon as possible after) the given instant.
     */
    Timer schedule(Runnable task, Instant fireAt);

    /**
     * Cancel all pending timers and release threads.
     */
    @Override
    void close();

    /**
     * Handle of a pending timer.
     */
    interface Timer {

        /**
         * Prevent the timer from firing. Has no effect once it fired.
         */
        void cancel();
    }
}
