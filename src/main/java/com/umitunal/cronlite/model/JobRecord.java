package com.umitunal.cronlite.model;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobPatch;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.NewJob;
import com.umitunal.cronlite.serialization.PayloadCodec;

import java.time.Instant;

/**
 * Stored form of a job with its state transitions.
 */
public class JobRecord implements Job {
    private final String id;
    private final String ownerId;
    private final JobType type;
    private final Instant createdAt;

    private String name;
    private String scheduleExpr;
    private JobConfig config;
    private boolean active;
    private Status status;
    private Instant lastRun;
    private Instant nextRun;
    private Instant updatedAt;
    private long version;  // For optimistic locking

    public JobRecord(String id, String ownerId, String name, JobType type, String scheduleExpr,
                     JobConfig config, boolean active, Instant createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.name = name;
        this.type = type;
        this.scheduleExpr = scheduleExpr;
        this.config = config != null ? config : JobConfig.empty();
        this.active = active;
        this.status = active ? Status.ACTIVE : Status.PAUSED;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.version = 0;
    }

    public static JobRecord fromRequest(String id, NewJob request, Instant now) {
        return new JobRecord(id, request.getOwnerId(), request.getName(), request.getType(),
                request.getScheduleExpr(), request.getConfig(), request.isActive(), now);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getOwnerId() {
        return ownerId;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public JobType getType() {
        return type;
    }

    @Override
    public String getScheduleExpr() {
        return scheduleExpr;
    }

    @Override
    public JobConfig getConfig() {
        return config;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Status getStatus() {
        return status;
    }

    @Override
    public Instant getLastRun() {
        return lastRun;
    }

    @Override
    public Instant getNextRun() {
        return nextRun;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    // Package-private setters for deserialization
    void setStatus(Status status) {
        this.status = status;
    }

    void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    void setNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }

    void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    void setVersion(long version) {
        this.version = version;
    }

    /**
     * Apply the mutable fields of a patch. Toggling the active flag moves the
     * status between ACTIVE and PAUSED.
     */
    public void apply(JobPatch patch, Instant now) {
        if (patch.hasName()) {
            this.name = patch.getName();
        }
        if (patch.hasSchedule()) {
            this.scheduleExpr = patch.getScheduleExpr();
        }
        if (patch.hasConfig()) {
            this.config = patch.getConfig();
        }
        if (patch.hasActive()) {
            boolean wasActive = this.active;
            this.active = patch.getActive();
            if (wasActive && !active) {
                this.status = Status.PAUSED;
            } else if (!wasActive && active) {
                this.status = Status.ACTIVE;
            }
        }
        if (!isSchedulable()) {
            this.nextRun = null;
        }
        touch(now);
    }

    public void markRun(Status status, Instant attemptTime, Instant now) {
        this.status = status;
        this.lastRun = attemptTime;
        touch(now);
    }

    public void markNextRun(Instant nextRun, Instant now) {
        this.nextRun = nextRun;
        touch(now);
    }

    public void markStatus(Status status, Instant now) {
        this.status = status;
        touch(now);
    }

    private void touch(Instant now) {
        this.updatedAt = now;
        this.version++;  // Increment version on state change
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', name='%s', type=%s, schedule='%s', active=%s, status=%s, next=%s}",
                id, name, type, scheduleExpr, active, status, nextRun);
    }

    /**
     * Serialize to bytes for storage.
     * Delegates to JobRecordSerializer for actual serialization logic.
     */
    public byte[] serialize(PayloadCodec<JobConfig> codec) {
        return new JobRecordSerializer(codec).serialize(this);
    }

    /**
     * Deserialize from bytes.
     * Delegates to JobRecordSerializer for actual deserialization logic.
     */
    public static JobRecord deserialize(byte[] bytes, PayloadCodec<JobConfig> codec) {
        return new JobRecordSerializer(codec).deserialize(bytes);
    }
}
