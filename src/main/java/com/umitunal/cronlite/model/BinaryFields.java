package com.umitunal.cronlite.model;

import java.nio.ByteBuffer;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Length-prefixed field helpers shared by the record serializers.
 * Null strings are written with length -1, null instants as Long.MIN_VALUE.
 */
final class BinaryFields {
    private static final long NULL_INSTANT = Long.MIN_VALUE;

    private BinaryFields() {
    }

    static byte[] bytes(String value) {
        return value != null ? value.getBytes(UTF_8) : null;
    }

    static int sizeOf(byte[] encoded) {
        return 4 + (encoded != null ? encoded.length : 0);
    }

    static void putBytes(ByteBuffer buffer, byte[] encoded) {
        if (encoded == null) {
            buffer.putInt(-1);
        } else {
            buffer.putInt(encoded.length);
            buffer.put(encoded);
        }
    }

    static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] encoded = new byte[length];
        buffer.get(encoded);
        return encoded;
    }

    static String getString(ByteBuffer buffer) {
        byte[] encoded = getBytes(buffer);
        return encoded != null ? new String(encoded, UTF_8) : null;
    }

    static void putInstant(ByteBuffer buffer, Instant instant) {
        buffer.putLong(instant != null ? instant.toEpochMilli() : NULL_INSTANT);
    }

    static Instant getInstant(ByteBuffer buffer) {
        long millis = buffer.getLong();
        return millis == NULL_INSTANT ? null : Instant.ofEpochMilli(millis);
    }
}
