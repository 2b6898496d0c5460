package com.umitunal.examples;

import com.umitunal.cronlite.collaborator.DuplicateSet;
import com.umitunal.cronlite.collaborator.FileMaintenanceService;
import com.umitunal.cronlite.config.CronLiteSettings;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionLogEntry;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobPatch;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.NewJob;
import com.umitunal.cronlite.core.Page;
import com.umitunal.cronlite.scheduler.JobScheduler;
import com.umitunal.cronlite.serialization.PayloadCodecs;
import com.umitunal.cronlite.storage.RocksJobStore;
import com.umitunal.cronlite.task.TaskRegistry;
import com.umitunal.cronlite.task.handler.CleanupTaskHandler;
import com.umitunal.cronlite.task.handler.DuplicateDetectionTaskHandler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cron scheduling example - two jobs firing every few seconds, one of them paused halfway.
 */
public class ScheduledJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Scheduled Jobs Example ===\n");

        AtomicLong purgeCalls = new AtomicLong();
        FileMaintenanceService files = new FileMaintenanceService() {
            @Override
            public long purgeSoftDeleted(Instant olderThan) {
                purgeCalls.incrementAndGet();
                return 3;
            }

            @Override
            public long deactivateExpiredShares() {
                return 1;
            }
        };

        TaskRegistry registry = TaskRegistry.builder()
                .register(JobType.CLEANUP, new CleanupTaskHandler(files, Clock.systemUTC()))
                .register(JobType.DUPLICATE_DETECTION, new DuplicateDetectionTaskHandler(() -> List.of(
                        new DuplicateSet("ab12", List.of("f1", "f2", "f3")),
                        new DuplicateSet("cd34", List.of("f4")))))
                .build();

        // Zone, thread counts and codec come from cronlite.properties or the environment
        CronLiteSettings settings = CronLiteSettings.load();
        StorageConfig config = StorageConfig.newBuilder("/tmp/cronlite-scheduled")
                .build();

        try (JobStore store = new RocksJobStore(config, registry,
                PayloadCodecs.forName(settings.getCodec()), Clock.system(settings.toSchedulerConfig().getZone()));
             JobScheduler scheduler = JobScheduler.create(store, registry, settings.toSchedulerConfig())) {

            scheduler.start();

            // Six-field expressions: seconds come first
            Job cleanup = store.create(NewJob.newBuilder("demo", "cleanup every 2s", JobType.CLEANUP)
                    .withSchedule("*/2 * * * * *")
                    .withConfig(JobConfig.of(CleanupTaskHandler.RETENTION_DAYS, 7))
                    .build());
            Job duplicates = store.create(NewJob.newBuilder("demo", "duplicates every 3s", JobType.DUPLICATE_DETECTION)
                    .withSchedule("*/3 * * * * *")
                    .build());

            System.out.println("Armed jobs: " + scheduler.armedJobIds());
            System.out.println("Cleanup next run: " + store.get(cleanup.getId()).getNextRun());

            Thread.sleep(5000);

            System.out.println("\nPausing cleanup job...");
            store.update(cleanup.getId(), JobPatch.newBuilder().withActive(false).build());
            System.out.println("Armed jobs: " + scheduler.armedJobIds());

            Thread.sleep(3000);

            System.out.println("\nCleanup purge calls: " + purgeCalls.get());
            for (Job job : List.of(cleanup, duplicates)) {
                Job current = store.get(job.getId());
                System.out.println(current.getName() + " -> status=" + current.getStatus()
                        + ", lastRun=" + current.getLastRun());
                for (ExecutionLogEntry entry : store.listLogs(job.getId(), Page.first(4)).getEntries()) {
                    System.out.println("  " + entry.getStatus() + ": " + entry.getMessage());
                }
            }

            System.out.println("\n" + store.getMetrics());

            store.delete(cleanup.getId());
            store.delete(duplicates.getId());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
