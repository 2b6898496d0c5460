package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.RemoteStorage;
import com.umitunal.cronlite.collaborator.TransferResult;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies configured local objects to remote storage.
 *
 * Config: {@code sources}, a list of local references (or a single string).
 * Every source is attempted; the run fails if any copy failed.
 */
public class BackupTaskHandler implements TaskHandler {
    public static final String SOURCES = "sources";

    private final RemoteStorage remote;

    public BackupTaskHandler(RemoteStorage remote) {
        this.remote = remote;
    }

    @Override
    public TaskResult execute(JobConfig config) throws Exception {
        List<String> sources = config.getStringList(SOURCES);
        if (sources.isEmpty()) {
            return TaskResult.failure("No backup sources configured");
        }

        List<String> failures = new ArrayList<>();
        for (String source : sources) {
            TransferResult result = remote.copyToRemote(source);
            if (!result.isOk()) {
                failures.add(source + " (" + result.getError() + ")");
            }
        }

        if (!failures.isEmpty()) {
            return TaskResult.failure(String.format("Backed up %d of %d sources, failed: %s",
                    sources.size() - failures.size(), sources.size(), String.join(", ", failures)));
        }
        return TaskResult.success("Backed up " + sources.size() + " sources");
    }
}
