package com.umitunal.cronlite.core;

import java.time.Instant;

/**
 * Thrown when a valid expression has no match within the search horizon.
 */
public class NoUpcomingOccurrenceException extends CronLiteException {

    public NoUpcomingOccurrenceException(String expression, Instant after, int horizonYears) {
        super(String.format("Schedule '%s' has no occurrence within %d years after %s",
                expression, horizonYears, after));
    }
}
