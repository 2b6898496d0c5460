package com.umitunal.cronlite.core;

public class JobNotFoundException extends CronLiteException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
