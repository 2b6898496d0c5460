package com.umitunal.cronlite.core;

/**
 * Base class of all scheduler errors.
 */
public class CronLiteException extends RuntimeException {

    public CronLiteException(String message) {
        super(message);
    }

    public CronLiteException(String message, Throwable cause) {
        super(message, cause);
    }
}
