package org.Aayush.gridopt.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Training progress view. Loss fields are {@code NaN} until the first episode is recorded.
 */
@Value
@Builder
public class LossMetrics {
    /** Oldest first, at most the configured window. */
    @Singular("historyEntry")
    List<HistoryEntry> history;
    /** Minimum loss percent ever recorded, including entries already evicted from the window. */
    double bestLoss;
    double worstLoss;
    long episodesTrained;
    double currentLossPercent;
    double currentAvgRisk;
}
