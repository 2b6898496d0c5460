package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionLogEntry;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobChange;
import com.umitunal.cronlite.core.JobConfig;
import com.umitunal.cronlite.core.JobFilter;
import com.umitunal.cronlite.core.JobMetrics;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobPatch;
import com.umitunal.cronlite.core.JobStore;
import com.umitunal.cronlite.core.JobStoreListener;
import com.umitunal.cronlite.core.LogPage;
import com.umitunal.cronlite.core.NewJob;
import com.umitunal.cronlite.core.Page;
import com.umitunal.cronlite.core.StoreException;
import com.umitunal.cronlite.core.UnknownJobTypeException;
import com.umitunal.cronlite.model.ExecutionLogSerializer;
import com.umitunal.cronlite.model.JobRecord;
import com.umitunal.cronlite.schedule.CronExpression;
import com.umitunal.cronlite.serialization.PayloadCodec;
import com.umitunal.cronlite.serialization.PayloadCodecs;
import com.umitunal.cronlite.task.TaskRegistry;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.Cache;
import org.rocksdb.CompressionType;
import org.rocksdb.Filter;
import org.rocksdb.LRUCache;
import org.rocksdb.OptimisticTransactionDB;
import org.rocksdb.OptimisticTransactionOptions;
import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Status;
import org.rocksdb.Transaction;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * RocksDB-backed implementation of JobStore.
 * Read-modify-write operations run in optimistic transactions and are retried on conflict,
 * so concurrent status updates of different jobs never lose writes.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private static final Comparator<Job> NEWEST_FIRST =
            Comparator.comparing(Job::getCreatedAt).reversed().thenComparing(Job::getId);

    private final OptimisticTransactionDB transactionDB;
    private final PayloadCodec<JobConfig> codec;
    private final ExecutionLogSerializer logSerializer;
    private final TaskRegistry registry;
    private final Clock clock;
    private final int maxTransactionRetries;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions pointReadOpts;
    private final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final AtomicLong logSequence;
    private final AtomicLong txnRetryCount = new AtomicLong(0);
    private final List<JobStoreListener> listeners = new CopyOnWriteArrayList<>();

    public RocksJobStore(StorageConfig config, TaskRegistry registry) throws RocksDBException {
        this(config, registry, PayloadCodecs.json(), Clock.systemUTC());
    }

    public RocksJobStore(StorageConfig config, TaskRegistry registry, PayloadCodec<JobConfig> codec, Clock clock)
            throws RocksDBException {
        this.registry = registry;
        this.codec = codec;
        this.clock = clock;
        this.maxTransactionRetries = config.getMaxTransactionRetries();
        this.logSerializer = new ExecutionLogSerializer();

        RocksDB.loadLibrary();

        this.blockCache = new LRUCache(32 * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setTableFormatConfig(tableConfig);

        // Open as OptimisticTransactionDB for atomic read-modify-write
        this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory());

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.pointReadOpts = new ReadOptions();

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        this.logSequence = new AtomicLong(findLastLogSequence());
    }

    @Override
    public Job create(NewJob request) {
        Objects.requireNonNull(request.getOwnerId(), "ownerId");
        Objects.requireNonNull(request.getType(), "type");
        requireName(request.getName());
        if (!registry.isRegistered(request.getType())) {
            throw new UnknownJobTypeException(request.getType().getTag());
        }
        if (request.getScheduleExpr() != null) {
            validateSchedule(request.getScheduleExpr());
        }

        JobRecord record = JobRecord.fromRequest(UUID.randomUUID().toString(), request, now());
        inTransaction("create job " + record.getId(), txn -> {
            txn.put(StorageKeys.jobKey(record.getId()), record.serialize(codec));
            return null;
        });

        log.info("Created job {} ({}) of type {} with schedule '{}'",
                record.getName(), record.getId(), record.getType(), record.getScheduleExpr());

        notifySaved(JobChange.created(record));
        return find(record.getId()).orElse(record);
    }

    @Override
    public Job get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public Optional<Job> find(String jobId) {
        try {
            byte[] value = transactionDB.get(pointReadOpts, StorageKeys.jobKey(jobId));
            return value == null ? Optional.empty() : Optional.of(JobRecord.deserialize(value, codec));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read job " + jobId, e);
        }
    }

    @Override
    public List<Job> list(JobFilter filter) {
        List<Job> jobs = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(StorageKeys.JOB_PREFIX);

            while (iter.isValid() && StorageKeys.startsWith(iter.key(), StorageKeys.JOB_PREFIX)) {
                JobRecord record = JobRecord.deserialize(iter.value(), codec);
                if (filter.matches(record)) {
                    jobs.add(record);
                }
                iter.next();
            }
        }
        jobs.sort(NEWEST_FIRST);
        return jobs;
    }

    @Override
    public Job update(String jobId, JobPatch patch) {
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("No valid fields to update");
        }
        if (patch.hasName()) {
            requireName(patch.getName());
        }
        if (patch.hasSchedule() && patch.getScheduleExpr() != null) {
            validateSchedule(patch.getScheduleExpr());
        }

        JobRecord[] previous = new JobRecord[1];
        JobRecord updated = inTransaction("update job " + jobId, txn -> {
            byte[] key = StorageKeys.jobKey(jobId);
            byte[] value = txn.getForUpdate(pointReadOpts, key, true);
            if (value == null) {
                throw new JobNotFoundException(jobId);
            }

            previous[0] = JobRecord.deserialize(value, codec);
            JobRecord record = JobRecord.deserialize(value, codec);
            record.apply(patch, now());
            txn.put(key, record.serialize(codec));
            return record;
        });

        log.info("Updated job {} ({}): {}", updated.getName(), jobId, patch);

        notifySaved(JobChange.updated(previous[0], updated, patch));
        return find(jobId).orElse(updated);
    }

    @Override
    public boolean delete(String jobId) {
        if (find(jobId).isEmpty()) {
            return false;
        }

        // Listeners disarm before the record disappears
        for (JobStoreListener listener : listeners) {
            listener.onJobDeleting(jobId);
        }

        boolean deleted = inTransaction("delete job " + jobId, txn -> {
            byte[] key = StorageKeys.jobKey(jobId);
            if (txn.getForUpdate(pointReadOpts, key, true) == null) {
                return false;
            }
            txn.delete(key);
            return true;
        });

        if (deleted) {
            log.info("Deleted job {}", jobId);
            for (JobStoreListener listener : listeners) {
                listener.onJobDeleted(jobId);
            }
        }
        return deleted;
    }

    @Override
    public ExecutionLogEntry appendLog(ExecutionLogEntry entry) {
        ExecutionLogEntry stored = entry.withId(logSequence.incrementAndGet());
        try {
            transactionDB.put(writeOpts, StorageKeys.logKey(stored.getJobId(), stored.getId()),
                    logSerializer.serialize(stored));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to append log entry for job " + entry.getJobId(), e);
        }
        return stored;
    }

    @Override
    public LogPage listLogs(String jobId, Page page) {
        byte[] prefix = StorageKeys.logPrefix(jobId);
        List<ExecutionLogEntry> entries = new ArrayList<>();
        long total = 0;

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            // Walk backwards from the end of this job's range: newest first
            iter.seekForPrev(StorageKeys.upperBound(prefix));

            while (iter.isValid() && StorageKeys.startsWith(iter.key(), prefix)) {
                if (total >= page.getOffset() && entries.size() < page.getLimit()) {
                    entries.add(logSerializer.deserialize(iter.value()));
                }
                total++;
                iter.prev();
            }
        }

        return new LogPage(entries, total, page.getOffset(), page.getLimit());
    }

    @Override
    public void recordRun(String jobId, Job.Status status, Instant lastRun) {
        Instant attempt = lastRun.truncatedTo(ChronoUnit.MILLIS);
        mutate(jobId, "record run", record -> record.markRun(status, attempt, now()));
    }

    @Override
    public void recordNextRun(String jobId, Instant nextRun) {
        Instant next = nextRun != null ? nextRun.truncatedTo(ChronoUnit.MILLIS) : null;
        mutate(jobId, "record next run", record -> record.markNextRun(next, now()));
    }

    @Override
    public void recordStatus(String jobId, Job.Status status) {
        mutate(jobId, "record status", record -> record.markStatus(status, now()));
    }

    @Override
    public JobMetrics getMetrics() {
        long total = 0;
        long active = 0;
        long scheduled = 0;
        long paused = 0;
        long completed = 0;
        long failed = 0;
        long logEntries = 0;

        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(StorageKeys.JOB_PREFIX);

            while (iter.isValid() && StorageKeys.startsWith(iter.key(), StorageKeys.JOB_PREFIX)) {
                JobRecord record = JobRecord.deserialize(iter.value(), codec);
                total++;
                if (record.isActive()) active++;
                if (record.isSchedulable()) scheduled++;

                switch (record.getStatus()) {
                    case PAUSED -> paused++;
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    default -> { }
                }

                iter.next();
            }

            iter.seek(StorageKeys.LOG_PREFIX);
            while (iter.isValid() && StorageKeys.startsWith(iter.key(), StorageKeys.LOG_PREFIX)) {
                logEntries++;
                iter.next();
            }
        }

        return new JobMetrics(total, active, scheduled, paused, completed, failed, logEntries);
    }

    @Override
    public void addListener(JobStoreListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(JobStoreListener listener) {
        listeners.remove(listener);
    }

    /**
     * Get the number of transaction retries that occurred.
     * Useful for monitoring contention.
     */
    public long getTransactionRetryCount() {
        return txnRetryCount.get();
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (pointReadOpts != null) {
            pointReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }

    private void mutate(String jobId, String action, Consumer<JobRecord> change) {
        inTransaction(action + " for job " + jobId, txn -> {
            byte[] key = StorageKeys.jobKey(jobId);
            byte[] value = txn.getForUpdate(pointReadOpts, key, true);
            if (value == null) {
                throw new JobNotFoundException(jobId);
            }

            JobRecord record = JobRecord.deserialize(value, codec);
            change.accept(record);
            txn.put(key, record.serialize(codec));
            return null;
        });
    }

    /**
     * Run the body in an optimistic transaction, retrying when the commit
     * conflicts with a concurrent writer.
     */
    private <R> R inTransaction(String action, TransactionBody<R> body) {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                R result = body.apply(txn);
                txn.commit();
                return result;
            } catch (RocksDBException e) {
                if (isConflict(e) && attempt < maxTransactionRetries) {
                    txnRetryCount.incrementAndGet();
                    log.debug("Transaction conflict on attempt {} to {}", attempt, action);
                    continue;
                }
                throw new StoreException("Failed to " + action, e);
            }
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private long findLastLogSequence() {
        long last = 0;
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seek(StorageKeys.LOG_PREFIX);
            while (iter.isValid() && StorageKeys.startsWith(iter.key(), StorageKeys.LOG_PREFIX)) {
                last = Math.max(last, StorageKeys.logSequence(iter.key()));
                iter.next();
            }
        }
        return last;
    }

    private void notifySaved(JobChange change) {
        for (JobStoreListener listener : listeners) {
            try {
                listener.onJobSaved(change);
            } catch (RuntimeException e) {
                log.error("Listener failed to handle change of job {}", change.getCurrent().getId(), e);
            }
        }
    }

    private void validateSchedule(String expression) {
        // Parse failures and schedules that never fire are both rejected up front
        CronExpression.parse(expression, clock.getZone()).nextFireTime(clock.instant());
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be empty");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @FunctionalInterface
    private interface TransactionBody<R> {
        R apply(Transaction txn) throws RocksDBException;
    }
}
