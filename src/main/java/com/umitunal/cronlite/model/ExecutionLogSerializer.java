package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.ExecutionLogEntry;

import java.nio.ByteBuffer;
import java.time.Instant;

import static com.umitunal.cronlite.model.BinaryFields.*;

/**
 * ByteBuffer serializer for execution log entries.
 *
 * Binary format:
 * - id (8 bytes)
 * - jobId, runId (length-prefixed UTF-8)
 * - status ordinal (4 bytes)
 * - message (length-prefixed UTF-8, -1 for null)
 * - startedAt, completedAt (8 bytes each, epoch millis)
 */
public class ExecutionLogSerializer {

    public byte[] serialize(ExecutionLogEntry entry) {
        byte[] jobIdBytes = bytes(entry.getJobId());
        byte[] runIdBytes = bytes(entry.getRunId());
        byte[] messageBytes = bytes(entry.getMessage());

        int totalSize = 8 +
                        sizeOf(jobIdBytes) +
                        sizeOf(runIdBytes) +
                        4 +
                        sizeOf(messageBytes) +
                        8 + 8;

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.putLong(entry.getId());
        putBytes(buffer, jobIdBytes);
        putBytes(buffer, runIdBytes);
        buffer.putInt(entry.getStatus().ordinal());
        putBytes(buffer, messageBytes);
        putInstant(buffer, entry.getStartedAt());
        putInstant(buffer, entry.getCompletedAt());
        return buffer.array();
    }

    public ExecutionLogEntry deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long id = buffer.getLong();
        String jobId = getString(buffer);
        String runId = getString(buffer);
        ExecutionLogEntry.Status status = ExecutionLogEntry.Status.values()[buffer.getInt()];
        String message = getString(buffer);
        Instant startedAt = getInstant(buffer);
        Instant completedAt = getInstant(buffer);
        return new ExecutionLogEntry(id, jobId, runId, status, message, startedAt, completedAt);
    }
}
