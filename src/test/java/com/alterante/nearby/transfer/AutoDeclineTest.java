package com.alterante.nearby.transfer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AutoDeclineTest {

    private ScheduledExecutorService timers;

    @BeforeEach
    void setUp() {
        timers = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        timers.shutdownNow();
    }

    @Test
    void firesOnceAfterTimeout() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(1);
        AutoDecline race = AutoDecline.start(timers, Duration.ofMillis(50), () -> {
            calls.incrementAndGet();
            latch.countDown();
        });
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, calls.get());
        assertTrue(race.hasFired());
        assertFalse(race.cancel(), "cancel after the timeout won");
    }

    @Test
    void cancelBeforeDeadlinePreventsFiring() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AutoDecline race = AutoDecline.start(timers, Duration.ofMillis(150), calls::incrementAndGet);
        assertTrue(race.cancel());
        assertFalse(race.cancel(), "second cancel is a no-op");
        Thread.sleep(300);
        assertEquals(0, calls.get());
        assertFalse(race.hasFired());
        assertTrue(race.isSettled());
    }

    @Test
    void settledRaceNeverFires() {
        AutoDecline race = AutoDecline.settled();
        assertTrue(race.isSettled());
        assertFalse(race.hasFired());
        assertFalse(race.cancel());
    }
}
