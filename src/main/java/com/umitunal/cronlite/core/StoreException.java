package com.umitunal.cronlite.core;

/**
 * Wraps failures of the underlying storage engine.
 */
public class StoreException extends CronLiteException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
