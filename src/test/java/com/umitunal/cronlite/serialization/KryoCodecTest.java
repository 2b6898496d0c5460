package com.umitunal.cronlite.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.umitunal.cronlite.core.JobConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KryoCodecTest {

    @Test
    @DisplayName("Should encode and decode job configs with nested values")
    void testJobConfig() {
        // Given
        KryoCodec<JobConfig> codec = new KryoCodec<>(JobConfig.class);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "nightly");
        JobConfig original = JobConfig.of("retentionDays", 30)
                .with("targets", new ArrayList<>(List.of("/docs", "/photos")))
                .with("payload", payload);

        // When
        byte[] encoded = codec.encode(original);
        JobConfig decoded = codec.decode(encoded);

        // Then
        assertThat(decoded).isEqualTo(original);
        assertThat(decoded.getInt("retentionDays", 0)).isEqualTo(30);
        assertThat(decoded.getStringList("targets")).containsExactly("/docs", "/photos");
        assertThat(decoded.getMap("payload")).containsEntry("event", "nightly");
    }

    @Test
    @DisplayName("Should decode an empty config")
    void testEmptyConfig() {
        KryoCodec<JobConfig> codec = new KryoCodec<>(JobConfig.class);

        JobConfig decoded = codec.decode(codec.encode(JobConfig.empty()));

        assertThat(decoded.size()).isZero();
    }

    @Test
    @DisplayName("Should work with custom Kryo factory")
    void testCustomFactory() {
        // Given
        KryoCodec<JobConfig> codec = new KryoCodec<>(JobConfig.class, () -> {
            Kryo kryo = new Kryo();
            kryo.setRegistrationRequired(false);
            kryo.setReferences(false);
            kryo.register(JobConfig.class);
            return kryo;
        });
        JobConfig original = JobConfig.of("url", "http://example.test/hook");

        // When
        JobConfig decoded = codec.decode(codec.encode(original));

        // Then
        assertThat(decoded.getString("url", null)).isEqualTo("http://example.test/hook");
    }

    @Test
    @DisplayName("Should be thread-safe")
    void testThreadSafety() throws InterruptedException {
        // Given
        KryoCodec<JobConfig> codec = new KryoCodec<>(JobConfig.class);
        int threadCount = 8;
        int iterations = 100;
        Thread[] threads = new Thread[threadCount];
        List<Throwable> errors = new ArrayList<>();

        // When
        for (int i = 0; i < threadCount; i++) {
            final int threadNum = i;
            threads[i] = new Thread(() -> {
                try {
                    for (int j = 0; j < iterations; j++) {
                        JobConfig original = JobConfig.of("thread", threadNum).with("iteration", j);
                        assertThat(codec.decode(codec.encode(original))).isEqualTo(original);
                    }
                } catch (Throwable t) {
                    synchronized (errors) {
                        errors.add(t);
                    }
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertThat(errors).isEmpty();
    }

    @Test
    @DisplayName("Should wrap truncated input in CodecException")
    void testCorruptInput() {
        KryoCodec<JobConfig> codec = new KryoCodec<>(JobConfig.class);

        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(CodecException.class);
    }
}
