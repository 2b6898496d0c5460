package com.umitunal.cronlite.task.handler;

import com.umitunal.cronlite.collaborator.TransferResult;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.task.TaskHandler.TaskResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BackupTaskHandlerTest {

    @Test
    @DisplayName("Should copy every configured source")
    void testCopiesAllSources() throws Exception {
        // Given
        List<String> copied = new ArrayList<>();
        BackupTaskHandler handler = new BackupTaskHandler(source -> {
            copied.add(source);
            return TransferResult.ok();
        });

        // When
        TaskResult result = handler.execute(JobConfig.of(BackupTaskHandler.SOURCES, List.of("/docs", "/photos")));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(copied).containsExactly("/docs", "/photos");
        assertThat(result.getMessage()).isEqualTo("Backed up 2 sources");
    }

    @Test
    @DisplayName("Should attempt all sources and fail when one copy fails")
    void testPartialFailure() throws Exception {
        // Given
        List<String> attempted = new ArrayList<>();
        BackupTaskHandler handler = new BackupTaskHandler(source -> {
            attempted.add(source);
            return source.equals("/docs") ? TransferResult.error("quota exceeded") : TransferResult.ok();
        });

        // When
        TaskResult result = handler.execute(JobConfig.of(BackupTaskHandler.SOURCES, List.of("/docs", "/photos")));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(attempted).containsExactly("/docs", "/photos");
        assertThat(result.getMessage()).contains("Backed up 1 of 2 sources", "/docs (quota exceeded)");
    }

    @Test
    @DisplayName("Should accept a single source string")
    void testSingleSource() throws Exception {
        BackupTaskHandler handler = new BackupTaskHandler(source -> TransferResult.ok());

        TaskResult result = handler.execute(JobConfig.of(BackupTaskHandler.SOURCES, "/docs"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Backed up 1 sources");
    }

    @Test
    @DisplayName("Should fail without sources")
    void testNoSources() throws Exception {
        BackupTaskHandler handler = new BackupTaskHandler(source -> TransferResult.ok());

        TaskResult result = handler.execute(JobConfig.empty());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).isEqualTo("No backup sources configured");
    }
}
