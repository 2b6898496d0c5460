package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.serialization.PayloadCodec;

import java.nio.ByteBuffer;
import java.time.Instant;

import static com.umitunal.cronlite.model.BinaryFields.*;

/**
 * ByteBuffer serializer for JobRecord.
 *
 * Binary format (strings are length-prefixed UTF-8, -1 for null):
 * - format version (1 byte)
 * - id, ownerId, name, type tag, scheduleExpr
 * - config length (4 bytes) + config bytes from the payload codec
 * - active (1 byte)
 * - status ordinal (4 bytes)
 * - lastRun, nextRun, createdAt, updatedAt (8 bytes each, epoch millis)
 * - version (8 bytes)
 */
public class JobRecordSerializer {
    private static final byte FORMAT_VERSION = 1;

    private final PayloadCodec<JobConfig> configCodec;

    public JobRecordSerializer(PayloadCodec<JobConfig> configCodec) {
        this.configCodec = configCodec;
    }

    public byte[] serialize(JobRecord record) {
        byte[] idBytes = bytes(record.getId());
        byte[] ownerBytes = bytes(record.getOwnerId());
        byte[] nameBytes = bytes(record.getName());
        byte[] typeBytes = bytes(record.getType().getTag());
        byte[] scheduleBytes = bytes(record.getScheduleExpr());
        byte[] configBytes = configCodec.encode(record.getConfig());

        int totalSize = 1 +
                        sizeOf(idBytes) +
                        sizeOf(ownerBytes) +
                        sizeOf(nameBytes) +
                        sizeOf(typeBytes) +
                        sizeOf(scheduleBytes) +
                        sizeOf(configBytes) +
                        1 +                 // active
                        4 +                 // status ordinal
                        8 * 4 +             // timestamps
                        8;                  // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);

        putBytes(buffer, idBytes);
        putBytes(buffer, ownerBytes);
        putBytes(buffer, nameBytes);
        putBytes(buffer, typeBytes);
        putBytes(buffer, scheduleBytes);
        putBytes(buffer, configBytes);

        buffer.put((byte) (record.isActive() ? 1 : 0));
        buffer.putInt(record.getStatus().ordinal());

        putInstant(buffer, record.getLastRun());
        putInstant(buffer, record.getNextRun());
        putInstant(buffer, record.getCreatedAt());
        putInstant(buffer, record.getUpdatedAt());

        buffer.putLong(record.getVersion());

        return buffer.array();
    }

    public JobRecord deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);

        byte format = buffer.get();
        if (format != FORMAT_VERSION) {
            throw new IllegalStateException("Unsupported job record format: " + format);
        }

        String id = getString(buffer);
        String ownerId = getString(buffer);
        String name = getString(buffer);
        JobType type = JobType.fromTag(getString(buffer));
        String scheduleExpr = getString(buffer);
        byte[] configBytes = getBytes(buffer);
        JobConfig config = configBytes != null ? configCodec.decode(configBytes) : JobConfig.empty();
        boolean active = buffer.get() == 1;
        Job.Status status = Job.Status.values()[buffer.getInt()];

        Instant lastRun = getInstant(buffer);
        Instant nextRun = getInstant(buffer);
        Instant createdAt = getInstant(buffer);
        Instant updatedAt = getInstant(buffer);

        JobRecord record = new JobRecord(id, ownerId, name, type, scheduleExpr, config, active, createdAt);

        // Restore internal state
        record.setStatus(status);
        record.setLastRun(lastRun);
        record.setNextRun(nextRun);
        record.setUpdatedAt(updatedAt);
        record.setVersion(buffer.getLong());

        return record;
    }
}
