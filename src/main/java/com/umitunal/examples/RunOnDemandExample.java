package com.umitunal.examples;

import com.umitunal.cronlite.collaborator.ScanReport;
import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionLogEntry;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.NewJob;
import com.umitunal.cronlite.core.Page;
import com.umitunal.cronlite.scheduler.ExecutionOutcome;
import com.umitunal.cronlite.scheduler.JobScheduler;
import com.umitunal.cronlite.storage.RocksJobStore;
import com.umitunal.cronlite.task.TaskRegistry;
import com.umitunal.cronlite.task.handler.VirusScanTaskHandler;

import java.util.List;

/**
 * On-demand execution example - a job without a schedule, run twice by hand.
 */
public class RunOnDemandExample {

    public static void main(String[] args) {
        System.out.println("=== Run On Demand Example ===\n");

        TaskRegistry registry = TaskRegistry.builder()
                .register(JobType.VIRUS_SCAN, new VirusScanTaskHandler(target -> target.contains("uploads")
                        ? new ScanReport(target, 12, List.of("eicar.txt"))
                        : ScanReport.clean(target, 40)))
                .build();

        StorageConfig config = StorageConfig.newBuilder("/tmp/cronlite-on-demand")
                .withDurableWrites(false)
                .build();

        try (JobStore store = new RocksJobStore(config, registry);
             JobScheduler scheduler = JobScheduler.create(store, registry, SchedulerConfig.defaults())) {

            scheduler.start();

            Job clean = store.create(NewJob.newBuilder("demo", "scan documents", JobType.VIRUS_SCAN)
                    .withConfig(JobConfig.of(VirusScanTaskHandler.TARGETS, List.of("/documents")))
                    .build());
            Job infected = store.create(NewJob.newBuilder("demo", "scan uploads", JobType.VIRUS_SCAN)
                    .withConfig(JobConfig.of(VirusScanTaskHandler.TARGETS, List.of("/uploads")))
                    .build());

            System.out.println("Armed jobs (none expected): " + scheduler.armedJobIds());

            for (Job job : List.of(clean, infected)) {
                ExecutionOutcome outcome = scheduler.runNow(job.getId()).get();
                System.out.println(job.getName() + " -> " + outcome);
                System.out.println("  status now " + store.get(job.getId()).getStatus());
                for (ExecutionLogEntry entry : store.listLogs(job.getId(), Page.defaults()).getEntries()) {
                    System.out.println("  " + entry.getStatus() + ": " + entry.getMessage());
                }
                store.delete(job.getId());
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
