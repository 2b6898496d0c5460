package com.umitunal.cronlite.core;

/**
 * Thrown at creation time when a job names a type without a handler.
 */
public class UnknownJobTypeException extends CronLiteException {

    public UnknownJobTypeException(String type) {
        super("Unknown job type: " + type);
    }
}
