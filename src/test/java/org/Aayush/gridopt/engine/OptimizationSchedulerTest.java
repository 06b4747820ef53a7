package org.Aayush.gridopt.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Optimization Scheduler Tests")
class OptimizationSchedulerTest {

    @Test
    @DisplayName("A failing cycle is counted and does not propagate")
    void testRunOnceFailure() {
        AtomicInteger calls = new AtomicInteger();
        OptimizationScheduler scheduler = new OptimizationScheduler(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        }, Duration.ofSeconds(1));

        assertFalse(scheduler.runOnce());
        assertTrue(scheduler.runOnce());
        assertEquals(1L, scheduler.failedCycles());
        assertEquals(1L, scheduler.completedCycles());
    }

    @Test
    @Timeout(10)
    @DisplayName("Loop keeps running after failures and stops cleanly")
    void testStartStop() throws InterruptedException {
        CountDownLatch fiveCycles = new CountDownLatch(5);
        AtomicInteger calls = new AtomicInteger();
        OptimizationScheduler scheduler = new OptimizationScheduler(() -> {
            fiveCycles.countDown();
            if (calls.incrementAndGet() % 2 == 0) {
                throw new IllegalStateException("every other cycle fails");
            }
        }, Duration.ofMillis(10));

        scheduler.start();
        assertTrue(scheduler.isRunning());
        assertThrows(IllegalStateException.class, scheduler::start);
        assertTrue(fiveCycles.await(5, TimeUnit.SECONDS));
        scheduler.stop();

        assertFalse(scheduler.isRunning());
        long total = scheduler.completedCycles() + scheduler.failedCycles();
        assertEquals(calls.get(), total);
        assertTrue(scheduler.failedCycles() >= 2);
        Thread.sleep(50);
        assertEquals(total, calls.get());

        scheduler.stop();
    }

    @Test
    @DisplayName("Rejects a non-positive interval")
    void testInvalidInterval() {
        assertThrows(IllegalArgumentException.class, () -> new OptimizationScheduler(() -> { }, Duration.ZERO));
    }
}
