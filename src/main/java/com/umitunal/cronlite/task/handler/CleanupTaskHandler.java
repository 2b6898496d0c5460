package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.FileMaintenanceService;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Purges soft-deleted files past the retention window and deactivates expired share links.
 *
 * Config: {@code retentionDays} (default 30).
 */
public class CleanupTaskHandler implements TaskHandler {
    private static final Logger log = LoggerFactory.getLogger(CleanupTaskHandler.class);

    public static final String RETENTION_DAYS = "retentionDays";
    public static final int DEFAULT_RETENTION_DAYS = 30;

    private final FileMaintenanceService files;
    private final Clock clock;

    public CleanupTaskHandler(FileMaintenanceService files, Clock clock) {
        this.files = files;
        this.clock = clock;
    }

    @Override
    public TaskResult execute(JobConfig config) throws Exception {
        int retentionDays = config.getInt(RETENTION_DAYS, DEFAULT_RETENTION_DAYS);
        if (retentionDays < 0) {
            return TaskResult.failure("retentionDays must not be negative: " + retentionDays);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        long purged = files.purgeSoftDeleted(cutoff);
        long shares = files.deactivateExpiredShares();

        log.debug("Cleanup purged {} files deleted before {}, deactivated {} share links", purged, cutoff, shares);
        return TaskResult.success(String.format(
                "Purged %d soft-deleted files older than %d days, deactivated %d expired share links",
                purged, retentionDays, shares));
    }
}
