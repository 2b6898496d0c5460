package com.umitunal.cronlite.task;

import com.umitunal.cronlite.core.JobConfig;

/**
 * Runs one job type's work. Handlers see only the job's config; they know
 * nothing of scheduling, run bookkeeping or other job types.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute the task to completion.
     *
     * @param config the job's payload
     * @return the task result
     * @throws Exception if the task fails; treated like a failure result
     */
    TaskResult execute(JobConfig config) throws Exception;

    /**
     * Result of a task execution.
     */
    class TaskResult {
        private final boolean success;
        private final String message;

        private TaskResult(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        public static TaskResult success() {
            return new TaskResult(true, null);
        }

        public static TaskResult success(String message) {
            return new TaskResult(true, message);
        }

        public static TaskResult failure(String message) {
            return new TaskResult(false, message);
        }

        @Override
        public String toString() {
            return (success ? "success" : "failure") + (message != null ? ": " + message : "");
        }
    }
}
