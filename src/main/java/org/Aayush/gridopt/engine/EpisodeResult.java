package org.Aayush.gridopt.engine;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one optimization cycle, published to readers.
 */
@Value
@Builder
public class EpisodeResult {
    long episode;
    /** Ordered by ascending substation id. */
    @Singular
    List<SubstationAssignment> assignments;
    /** Summed loss of resolved substations in MW. */
    double totalLoss;
    /** {@code 100 * totalLoss / resolvedDemand}. */
    double lossPercent;
    /** Mean risk over the distinct edges used by resolved paths. */
    double avgRisk;
    /** Declared demand of every substation. */
    double totalDemand;
    double resolvedDemand;
    double reward;
    double advantage;
    /** Whether the policy was updated from this episode. */
    boolean trained;
    int droppedTelemetry;
    int riskFallbacks;
    @Singular
    List<EdgeAlert> alerts;
    Instant publishedAt;

    public int resolvedCount() {
        int count = 0;
        for (SubstationAssignment assignment : assignments) {
            if (assignment.isResolved()) {
                count++;
            }
        }
        return count;
    }

    public int unresolvedCount() {
        return assignments.size() - resolvedCount();
    }
}
