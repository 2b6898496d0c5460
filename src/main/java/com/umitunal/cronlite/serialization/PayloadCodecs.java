package com.umitunal.cronlite.serialization;

import com.umitunal.cronlite.core.JobConfig;

import java.util.Locale;

/**
 * Named config codecs selectable from settings.
 */
public final class PayloadCodecs {

    private PayloadCodecs() {
    }

    public static PayloadCodec<JobConfig> json() {
        return new JsonCodec<>(JobConfig.class);
    }

    public static PayloadCodec<JobConfig> kryo() {
        return new KryoCodec<>(JobConfig.class);
    }

    /**
     * @param name "json" or "kryo", case-insensitive
     */
    public static PayloadCodec<JobConfig> forName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> json();
            case "kryo" -> kryo();
            default -> throw new IllegalArgumentException("Unknown payload codec: " + name);
        };
    }
}
