package com.umitunal.cronlite.core;

/**
 * Observer of job mutations. Callbacks run on the mutating thread.
 */
public interface JobStoreListener {

    /**
     * Called after a create or update has been committed.
     */
    void onJobSaved(JobChange change);

    /**
     * Called before a job record is removed. When this returns, no new
     * execution of the job may be started by the listener.
     */
    void onJobDeleting(String jobId);

    /**
     * Called after a job record has been removed.
     */
    default void onJobDeleted(String jobId) {
    }
}
