package org.Aayush.gridopt.engine;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic driver for optimization cycles.
 *
 * <p>Cycles run on one daemon thread with a fixed delay between the end of a cycle and the
 * start of the next. A failing cycle is logged and counted; the loop keeps going. Stopping is
 * cooperative: the running cycle always completes.</p>
 */
@Accessors(fluent = true)
public final class OptimizationScheduler {
    private static final Logger log = LogManager.getLogger(OptimizationScheduler.class);
    private static final Duration STOP_GRACE = Duration.ofSeconds(30);

    private final Runnable cycle;
    @Getter
    private final Duration interval;
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private ScheduledExecutorService executor;

    public OptimizationScheduler(Runnable cycle, Duration interval) {
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
    }

    /**
     * Starts the loop; the first cycle runs immediately.
     *
     * @throws IllegalStateException if already running.
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("scheduler already started");
        }
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "grid-optimizer");
            thread.setDaemon(true);
            return thread;
        });
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor = pool;
        executor.scheduleWithFixedDelay(this::runOnce, 0L, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Optimization loop started, interval {} ms", interval.toMillis());
    }

    /**
     * Runs exactly one cycle on the calling thread with the loop's error handling.
     *
     * @return whether the cycle completed without an exception.
     */
    public boolean runOnce() {
        try {
            cycle.run();
            completedCycles.incrementAndGet();
            return true;
        } catch (RuntimeException e) {
            failedCycles.incrementAndGet();
            log.error("Optimization cycle failed", e);
            return false;
        }
    }

    /**
     * Stops scheduling new cycles and waits for the running one to finish.
     */
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Optimization cycle still running after {} s", STOP_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the optimization loop to stop");
        }
        executor = null;
        log.info("Optimization loop stopped after {} cycles ({} failed)", completedCycles.get(), failedCycles.get());
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public long completedCycles() {
        return completedCycles.get();
    }

    public long failedCycles() {
        return failedCycles.get();
    }
}
