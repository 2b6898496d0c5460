package com.umitunal.cronlite.core;

/**
 * Thrown at execution time when the registry has no handler for a job's type.
 */
public class UnregisteredHandlerException extends CronLiteException {

    public UnregisteredHandlerException(JobType type) {
        super("No handler registered for job type: " + type);
    }
}
