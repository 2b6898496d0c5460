package com.umitunal.cronlite.storage;

import java.nio.ByteBuffer;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layout of the job store.
 *
 * <ul>
 *   <li>jobs: {@code j/<jobId>}</li>
 *   <li>log entries: {@code l/<jobId>\0<sequence>} with an 8-byte big-endian
 *       sequence, so one job's history is contiguous and ordered by append.</li>
 * </ul>
 */
final class StorageKeys {
    static final byte[] JOB_PREFIX = "j/".getBytes(UTF_8);
    static final byte[] LOG_PREFIX = "l/".getBytes(UTF_8);

    private static final byte SEPARATOR = 0;

    private StorageKeys() {
    }

    static byte[] jobKey(String jobId) {
        return concat(JOB_PREFIX, jobId.getBytes(UTF_8));
    }

    static byte[] logPrefix(String jobId) {
        byte[] jobIdBytes = jobId.getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(LOG_PREFIX.length + jobIdBytes.length + 1);
        buffer.put(LOG_PREFIX);
        buffer.put(jobIdBytes);
        buffer.put(SEPARATOR);
        return buffer.array();
    }

    static byte[] logKey(String jobId, long sequence) {
        byte[] prefix = logPrefix(jobId);
        ByteBuffer buffer = ByteBuffer.allocate(prefix.length + 8);
        buffer.put(prefix);
        buffer.putLong(sequence);
        return buffer.array();
    }

    static long logSequence(byte[] logKey) {
        return ByteBuffer.wrap(logKey, logKey.length - 8, 8).getLong();
    }

    /**
     * Smallest key greater than every key starting with the prefix.
     */
    static byte[] upperBound(byte[] prefix) {
        byte[] bound = Arrays.copyOf(prefix, prefix.length);
        for (int i = bound.length - 1; i >= 0; i--) {
            if (bound[i] != (byte) 0xFF) {
                bound[i]++;
                return Arrays.copyOf(bound, i + 1);
            }
        }
        throw new IllegalArgumentException("Prefix has no upper bound");
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
