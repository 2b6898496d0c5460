package com.umitunal.cronlite.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class ExecutorTimerServiceTest {

    private final ExecutorTimerService timers = new ExecutorTimerService(1, Clock.systemUTC());

    @AfterEach
    void tearDown() {
        timers.close();
    }

    @Test
    @DisplayName("Should run the task once the fire time is reached")
    void testFires() {
        AtomicInteger fired = new AtomicInteger();

        timers.schedule(fired::incrementAndGet, Clock.systemUTC().instant().plusMillis(100));

        await().atMost(2, TimeUnit.SECONDS).until(() -> fired.get() == 1);
    }

    @Test
    @DisplayName("Should run overdue tasks immediately")
    void testOverdue() {
        AtomicInteger fired = new AtomicInteger();

        timers.schedule(fired::incrementAndGet, Clock.systemUTC().instant().minusSeconds(60));

        await().atMost(1, TimeUnit.SECONDS).until(() -> fired.get() == 1);
    }

    @Test
    @DisplayName("Should not run cancelled tasks")
    void testCancel() {
        AtomicInteger fired = new AtomicInteger();

        TimerService.Timer timer = timers.schedule(fired::incrementAndGet,
                Clock.systemUTC().instant().plusMillis(200));
        timer.cancel();

        await().pollDelay(Duration.ofMillis(400)).atMost(1, TimeUnit.SECONDS).until(() -> true);
        assertThat(fired.get()).isZero();
    }
}
