package org.Aayush.gridopt.engine;

import org.Aayush.gridopt.topology.TopologySnapshot;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owner of the state published to readers.
 * <ul>
 * <li>A cycle lock serializes whole optimization cycles, scheduled or manual.</li>
 * <li>A read/write lock guards the published result, history, counters and snapshot; readers
 *     only ever receive immutable values.</li>
 * <li>Episodes are published strictly in order: each must be the previous one plus one.</li>
 * </ul>
 */
public final class GridStateGuard {
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();

    private final int historyWindow;
    private final ArrayDeque<HistoryEntry> history;
    private EpisodeResult latestResult;
    private TopologySnapshot topologySnapshot;
    private long episodesTrained;
    private double bestLoss = Double.NaN;
    private double worstLoss = Double.NaN;

    public GridStateGuard(int historyWindow, TopologySnapshot initialSnapshot) {
        this(historyWindow, initialSnapshot, 0L);
    }

    /**
     * @param publishedEpisodes episodes already completed before this guard took over; the next
     * publication must be {@code publishedEpisodes + 1}.
     */
    public GridStateGuard(int historyWindow, TopologySnapshot initialSnapshot, long publishedEpisodes) {
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be >= 1, got " + historyWindow);
        }
        if (publishedEpisodes < 0L) {
            throw new IllegalArgumentException("publishedEpisodes must be >= 0, got " + publishedEpisodes);
        }
        this.historyWindow = historyWindow;
        this.history = new ArrayDeque<>(historyWindow);
        this.topologySnapshot = Objects.requireNonNull(initialSnapshot, "initialSnapshot");
        this.episodesTrained = publishedEpisodes;
    }

    /**
     * Runs one orchestrator cycle under the cycle lock and publishes its outcome.
     * Concurrent callers queue behind the running cycle.
     *
     * @throws IllegalStateException before anything runs if the orchestrator's episode counter
     * is not aligned with the published episode count.
     */
    public EpisodeResult runCycle(EpisodeOrchestrator orchestrator) {
        Objects.requireNonNull(orchestrator, "orchestrator");
        cycleLock.lock();
        try {
            long published = episodesTrained();
            if (orchestrator.episodeCounter() != published) {
                throw new IllegalStateException(
                        "orchestrator is at episode " + orchestrator.episodeCounter()
                                + " but " + published + " episodes are published");
            }
            EpisodeOutcome outcome = orchestrator.runEpisode();
            publish(outcome);
            return outcome.result();
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Publishes one cycle's outcome atomically.
     *
     * @throws IllegalStateException if the episode number is not the next one in sequence.
     */
    public void publish(EpisodeOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        EpisodeResult result = outcome.result();
        stateLock.writeLock().lock();
        try {
            if (result.getEpisode() != episodesTrained + 1) {
                throw new IllegalStateException(
                        "out-of-order publication: expected episode " + (episodesTrained + 1)
                                + ", got " + result.getEpisode());
            }
            latestResult = result;
            topologySnapshot = outcome.snapshot();
            episodesTrained = result.getEpisode();
            if (outcome.recordInHistory()) {
                append(new HistoryEntry(result.getEpisode(), result.getLossPercent(), result.getAvgRisk()));
            }
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    private void append(HistoryEntry entry) {
        if (history.size() == historyWindow) {
            history.removeFirst();
        }
        history.addLast(entry);
        if (Double.isNaN(bestLoss) || entry.lossPercent() < bestLoss) {
            bestLoss = entry.lossPercent();
        }
        if (Double.isNaN(worstLoss) || entry.lossPercent() > worstLoss) {
            worstLoss = entry.lossPercent();
        }
    }

    public Optional<EpisodeResult> latestResult() {
        stateLock.readLock().lock();
        try {
            return Optional.ofNullable(latestResult);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * @return copy of the bounded history, oldest first.
     */
    public List<HistoryEntry> history() {
        stateLock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public long episodesTrained() {
        stateLock.readLock().lock();
        try {
            return episodesTrained;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * @return lowest loss percent ever recorded, {@code NaN} before the first.
     */
    public double bestLoss() {
        stateLock.readLock().lock();
        try {
            return bestLoss;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public TopologySnapshot topologySnapshot() {
        stateLock.readLock().lock();
        try {
            return topologySnapshot;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Consistent view of history, extremes and the latest result.
     */
    public LossMetrics lossMetrics() {
        stateLock.readLock().lock();
        try {
            return LossMetrics.builder()
                    .history(history)
                    .bestLoss(bestLoss)
                    .worstLoss(worstLoss)
                    .episodesTrained(episodesTrained)
                    .currentLossPercent(latestResult == null ? Double.NaN : latestResult.getLossPercent())
                    .currentAvgRisk(latestResult == null ? Double.NaN : latestResult.getAvgRisk())
                    .build();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public int historyWindow() {
        return historyWindow;
    }
}
