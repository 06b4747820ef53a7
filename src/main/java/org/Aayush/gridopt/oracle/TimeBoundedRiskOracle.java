package org.Aayush.gridopt.oracle;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator enforcing a hard latency bound on a delegate oracle.
 * <p>
 * Calls run on a dedicated daemon worker. A call that exceeds the timeout is cancelled and
 * reported as {@link RiskOracleUnavailableException}; so are delegate failures.
 * </p>
 */
@Accessors(fluent = true)
public final class TimeBoundedRiskOracle implements RiskOracle, AutoCloseable {
    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final RiskOracle delegate;
    @Getter
    private final Duration timeout;
    private final ExecutorService worker;

    public TimeBoundedRiskOracle(RiskOracle delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "risk-oracle-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public RiskAssessment score(RiskFeatures features) {
        Objects.requireNonNull(features, "features");
        Future<RiskAssessment> pending = worker.submit(() -> delegate.score(features));
        RiskAssessment assessment;
        try {
            assessment = pending.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new RiskOracleUnavailableException(
                    RiskOracleUnavailableException.REASON_TIMEOUT,
                    "risk oracle did not answer within " + timeout.toMillis() + " ms",
                    e
            );
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new RiskOracleUnavailableException(
                    RiskOracleUnavailableException.REASON_UNAVAILABLE, "interrupted while waiting for risk oracle", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RiskOracleUnavailableException unavailable) {
                throw unavailable;
            }
            throw new RiskOracleUnavailableException(
                    RiskOracleUnavailableException.REASON_UNAVAILABLE, "risk oracle failed: " + cause.getMessage(), cause);
        }
        if (assessment == null) {
            throw new RiskOracleUnavailableException(
                    RiskOracleUnavailableException.REASON_UNAVAILABLE, "risk oracle returned no assessment");
        }
        return assessment;
    }

    /**
     * Stops the worker; an in-flight delegate call is interrupted.
     */
    @Override
    public void close() {
        worker.shutdownNow();
    }
}
