package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.ScanReport;
import com.umitunal.cronlite.collaborator.VirusScanner;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans configured targets and fails when any threat is found.
 *
 * Config: {@code targets}, a list of references (or a single string).
 */
public class VirusScanTaskHandler implements TaskHandler {
    public static final String TARGETS = "targets";

    private final VirusScanner scanner;

    public VirusScanTaskHandler(VirusScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public TaskResult execute(JobConfig config) throws Exception {
        List<String> targets = config.getStringList(TARGETS);
        if (targets.isEmpty()) {
            return TaskResult.failure("No scan targets configured");
        }

        long scanned = 0;
        List<String> infected = new ArrayList<>();
        for (String target : targets) {
            ScanReport report = scanner.scan(target);
            scanned += report.getFilesScanned();
            if (!report.isClean()) {
                infected.add(target + " " + report.getThreats());
            }
        }

        if (!infected.isEmpty()) {
            return TaskResult.failure("Threats found in " + String.join(", ", infected));
        }
        return TaskResult.success("Scanned " + scanned + " files, no threats found");
    }
}
