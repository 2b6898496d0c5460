package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.ChecksumIndex;
import com.umitunal.cronlite.collaborator.DuplicateSet;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Groups files by checksum and reports the sets holding more than one file.
 */
public class DuplicateDetectionTaskHandler implements TaskHandler {
    private final ChecksumIndex index;

    public DuplicateDetectionTaskHandler(ChecksumIndex index) {
        this.index = index;
    }

    @Override
    public TaskResult execute(JobConfig config) throws Exception {
        List<DuplicateSet> duplicates = index.groupByChecksum().stream()
                .filter(DuplicateSet::isDuplicate)
                .collect(Collectors.toList());

        long redundantFiles = duplicates.stream()
                .mapToLong(set -> set.getFileIds().size() - 1)
                .sum();

        return TaskResult.success(String.format("Found %d sets of duplicate files (%d redundant copies)",
                duplicates.size(), redundantFiles));
    }
}
