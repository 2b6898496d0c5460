package com.umitunal.cronlite.collaborator;

import java.time.Instant;

/**
 * Maintenance operations of the host's virtual filesystem.
 */
public interface FileMaintenanceService {

    /**
     * Permanently remove soft-deleted files whose deletion time is before the cutoff.
     *
     * @return number of files purged
     */
    long purgeSoftDeleted(Instant olderThan) throws Exception;

    /**
     * Deactivate share links past their expiry.
     *
     * @return number of links deactivated
     */
    long deactivateExpiredShares() throws Exception;
}
